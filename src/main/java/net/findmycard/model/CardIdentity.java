package net.findmycard.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * Canonical, deduplicated view of a game object: one per independent
 * name and rules-text combination, regardless of how many printings exist.
 *
 * <p>The aggregated facets ({@code rarities}, {@code legalities},
 * {@code lowestPriceUsd}, {@code setCodes}) are folded from every printing of the
 * identity so filters can run without touching printings again.</p>
 */
public record CardIdentity(CardIdentityKey key,
                           String oracleId,
                           String name,
                           String typeLine,
                           String oracleText,
                           String manaCost,
                           double convertedManaCost,
                           Set<ManaColor> colors,
                           Set<ManaColor> colorIdentity,
                           Set<String> keywords,
                           String power,
                           String toughness,
                           Set<Rarity> rarities,
                           Map<String, Legality> legalities,
                           BigDecimal lowestPriceUsd,
                           Set<String> setCodes) {

    public CardIdentity {
        if (key == null) {
            throw new IllegalArgumentException("key is required");
        }
        typeLine = typeLine == null ? "" : typeLine;
        oracleText = oracleText == null ? "" : oracleText;
        colors = colors == null ? Set.of() : Set.copyOf(colors);
        colorIdentity = colorIdentity == null ? Set.of() : Set.copyOf(colorIdentity);
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        rarities = rarities == null ? Set.of() : Set.copyOf(rarities);
        legalities = legalities == null ? Map.of() : Map.copyOf(legalities);
        setCodes = setCodes == null ? Set.of() : Set.copyOf(setCodes);
    }
}
