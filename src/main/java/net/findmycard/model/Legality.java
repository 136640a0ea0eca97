package net.findmycard.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Format legality status of a card.
 */
public enum Legality {
    LEGAL,
    NOT_LEGAL,
    RESTRICTED,
    BANNED;

    /** Restricted cards are still playable, so they count as permitted. */
    public boolean isPlayable() {
        return this == LEGAL || this == RESTRICTED;
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Legality> fromWireValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Legality.valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
