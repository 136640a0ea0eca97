package net.findmycard.service.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;
import net.findmycard.service.identity.IdentityIndex;

/**
 * Immutable, deduplicated view of the whole catalog at one point in time.
 *
 * <p>Identities are listed in name order (ties by key). Each identity exposes all of
 * its printings ordered by printing id; the representative printing is the first
 * printing that carries the identity's own oracle id, or the first printing overall
 * for derived identities.</p>
 */
public final class CatalogSnapshot {

    public static final Comparator<CardIdentity> NAME_ORDER =
        Comparator.comparing(CardIdentity::name).thenComparing(CardIdentity::key);

    private final long version;
    private final Instant builtAt;
    private final Map<CardIdentityKey, CardIdentity> identities;
    private final Map<CardIdentityKey, List<CardPrinting>> printingsByKey;
    private final Map<CardIdentityKey, CardPrinting> representatives;
    private final Map<String, CardIdentityKey> keyByPrintingId;
    private final Map<String, CardIdentityKey> keyByOracleId;
    private final List<CardIdentity> identitiesByName;
    private final List<IdentityIndex.Ambiguity> ambiguities;

    private CatalogSnapshot(long version,
                            Instant builtAt,
                            Map<CardIdentityKey, CardIdentity> identities,
                            Map<CardIdentityKey, List<CardPrinting>> printingsByKey,
                            Map<CardIdentityKey, CardPrinting> representatives,
                            IdentityIndex.Assignment assignment) {
        this.version = version;
        this.builtAt = builtAt;
        this.identities = identities;
        this.printingsByKey = printingsByKey;
        this.representatives = representatives;
        this.keyByPrintingId = assignment.keyByPrintingId();
        this.keyByOracleId = assignment.keyByOracleId();
        this.ambiguities = assignment.ambiguities();
        List<CardIdentity> sorted = new ArrayList<>(identities.values());
        sorted.sort(NAME_ORDER);
        this.identitiesByName = List.copyOf(sorted);
    }

    public static CatalogSnapshot empty() {
        return build(List.of(), 0L);
    }

    public static CatalogSnapshot build(List<CardPrinting> printings, long version) {
        IdentityIndex.Assignment assignment = IdentityIndex.assign(printings);
        Map<CardIdentityKey, CardIdentity> identities = new LinkedHashMap<>();
        Map<CardIdentityKey, CardPrinting> representatives = new HashMap<>();
        assignment.groups().forEach((key, members) -> {
            CardPrinting representative = pickRepresentative(key, members);
            representatives.put(key, representative);
            identities.put(key, aggregate(key, representative, members));
        });
        return new CatalogSnapshot(version, Instant.now(), identities, assignment.groups(), representatives, assignment);
    }

    public long version() {
        return version;
    }

    public Instant builtAt() {
        return builtAt;
    }

    public Optional<CardIdentity> getByKey(CardIdentityKey key) {
        return Optional.ofNullable(identities.get(key));
    }

    public List<CardPrinting> getAllForIdentity(CardIdentityKey key) {
        return printingsByKey.getOrDefault(key, List.of());
    }

    public Optional<CardPrinting> representativeOf(CardIdentityKey key) {
        return Optional.ofNullable(representatives.get(key));
    }

    /** Every identity, ordered by name then key. */
    public List<CardIdentity> listIdentities() {
        return identitiesByName;
    }

    public Optional<CardIdentityKey> keyForPrinting(String printingId) {
        return Optional.ofNullable(keyByPrintingId.get(printingId));
    }

    public Optional<CardIdentityKey> keyForOracleId(String oracleId) {
        return Optional.ofNullable(keyByOracleId.get(oracleId));
    }

    public List<IdentityIndex.Ambiguity> ambiguities() {
        return ambiguities;
    }

    public int identityCount() {
        return identities.size();
    }

    public int printingCount() {
        return keyByPrintingId.size();
    }

    private static CardPrinting pickRepresentative(CardIdentityKey key, List<CardPrinting> members) {
        if (key.kind() == CardIdentityKey.Kind.ORACLE) {
            for (CardPrinting member : members) {
                if (key.value().equals(member.oracleId())) {
                    return member;
                }
            }
        }
        return members.get(0);
    }

    private static CardIdentity aggregate(CardIdentityKey key, CardPrinting representative, List<CardPrinting> members) {
        Set<Rarity> rarities = EnumSet.noneOf(Rarity.class);
        Set<String> setCodes = new TreeSet<>();
        BigDecimal lowestPrice = null;
        for (CardPrinting member : members) {
            if (member.rarity() != null) {
                rarities.add(member.rarity());
            }
            if (member.setCode() != null && !member.setCode().isBlank()) {
                setCodes.add(member.setCode().toLowerCase(Locale.ROOT));
            }
            BigDecimal price = member.lowestUsdPrice().orElse(null);
            if (price != null && (lowestPrice == null || price.compareTo(lowestPrice) < 0)) {
                lowestPrice = price;
            }
        }
        Set<ManaColor> colorIdentity = EnumSet.noneOf(ManaColor.class);
        colorIdentity.addAll(representative.colorIdentity());
        colorIdentity.addAll(representative.colors());

        return new CardIdentity(
            key,
            key.kind() == CardIdentityKey.Kind.ORACLE ? key.value() : null,
            representative.name(),
            representative.typeLine().isBlank() ? joinedFaceTypeLine(representative) : representative.typeLine(),
            representative.fullOracleText(),
            representative.manaCost(),
            representative.convertedManaCost(),
            representative.colors(),
            colorIdentity,
            representative.keywords(),
            representative.power(),
            representative.toughness(),
            rarities,
            representative.legalities(),
            lowestPrice,
            setCodes
        );
    }

    private static String joinedFaceTypeLine(CardPrinting printing) {
        return printing.cardFaces().stream()
            .map(face -> face.typeLine() == null ? "" : face.typeLine())
            .filter(typeLine -> !typeLine.isBlank())
            .reduce((left, right) -> left + " // " + right)
            .orElse("");
    }
}
