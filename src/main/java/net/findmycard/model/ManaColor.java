package net.findmycard.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The five colors of mana plus colorless, keyed by their single-letter symbol.
 */
public enum ManaColor {
    W("white"),
    U("blue"),
    B("black"),
    R("red"),
    G("green"),
    C("colorless");

    private final String displayName;

    ManaColor(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Parses either a symbol ({@code "W"}) or a full color name ({@code "white"}).
     */
    public static Optional<ManaColor> fromSymbol(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        for (ManaColor color : values()) {
            if (color.name().equalsIgnoreCase(trimmed)
                || color.displayName.equals(trimmed.toLowerCase(Locale.ROOT))) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }
}
