package net.findmycard.model;

import java.util.Objects;

/**
 * Canonical key of a {@link CardIdentity}.
 *
 * <p>An {@link Kind#ORACLE} key is the oracle id carried by the card-data feed. A
 * {@link Kind#DERIVED} key is built from a slug of the normalized name and a hash of the
 * normalized rules text, for printings that arrive without an oracle id.</p>
 *
 * @param kind how the key was produced
 * @param value the key body (oracle id, or {@code name-slug:hash} for derived keys)
 */
public record CardIdentityKey(Kind kind, String value) implements Comparable<CardIdentityKey> {

    public static final String DERIVED_PREFIX = "derived:";

    public enum Kind {
        ORACLE,
        DERIVED
    }

    public CardIdentityKey {
        Objects.requireNonNull(kind, "kind");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CardIdentityKey value must not be blank");
        }
    }

    public static CardIdentityKey oracle(String oracleId) {
        return new CardIdentityKey(Kind.ORACLE, oracleId.trim());
    }

    public static CardIdentityKey derived(String fingerprint) {
        return new CardIdentityKey(Kind.DERIVED, fingerprint);
    }

    /**
     * Parses the wire form produced by {@link #toString()}.
     */
    public static CardIdentityKey parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Cannot parse a blank identity key");
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith(DERIVED_PREFIX)) {
            return derived(trimmed.substring(DERIVED_PREFIX.length()));
        }
        return oracle(trimmed);
    }

    /** Cache tag used to purge every entry that depends on this identity. */
    public String cacheTag() {
        return "card-" + this;
    }

    @Override
    public int compareTo(CardIdentityKey other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return kind == Kind.DERIVED ? DERIVED_PREFIX + value : value;
    }
}
