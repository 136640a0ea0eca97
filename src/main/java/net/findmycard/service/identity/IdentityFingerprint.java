package net.findmycard.service.identity;

import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.util.CardTextNormalizer;
import net.findmycard.util.HashUtils;

/**
 * Name-and-rules-text fingerprint of a printing, independent of edition.
 *
 * @param normalizedName case, accent and whitespace folded name
 * @param textHash hex prefix of the SHA-256 of the normalized rules text
 */
public record IdentityFingerprint(String normalizedName, String textHash) implements Comparable<IdentityFingerprint> {

    static final int TEXT_HASH_LENGTH = 16;

    public static IdentityFingerprint of(CardPrinting printing) {
        return of(printing.name(), printing.fullOracleText());
    }

    public static IdentityFingerprint of(String name, String oracleText) {
        String normalizedName = CardTextNormalizer.normalizeName(name);
        String normalizedText = CardTextNormalizer.normalizeText(oracleText);
        return new IdentityFingerprint(normalizedName, HashUtils.sha256HexPrefix(normalizedText, TEXT_HASH_LENGTH));
    }

    /**
     * Derived key {@code <slug>:<hash>}; the slug keeps the key usable as a single path segment.
     */
    public CardIdentityKey toDerivedKey() {
        String slug = CardTextNormalizer.slug(normalizedName);
        return CardIdentityKey.derived((slug.isEmpty() ? "card" : slug) + ":" + textHash);
    }

    @Override
    public int compareTo(IdentityFingerprint other) {
        int byName = normalizedName.compareTo(other.normalizedName);
        return byName != 0 ? byName : textHash.compareTo(other.textHash);
    }
}
