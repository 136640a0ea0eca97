package net.findmycard.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Printing rarity as reported by the card-data feed.
 */
public enum Rarity {
    COMMON,
    UNCOMMON,
    RARE,
    MYTHIC,
    SPECIAL,
    BONUS;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Rarity> fromWireValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Rarity.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
