package net.findmycard.service.scoring;

import java.util.Locale;
import java.util.Optional;

/**
 * Recommendation strategies selectable through the {@code type} request parameter.
 */
public enum RecommendationStrategy {
    SYNERGY("synergy"),
    FUNCTIONAL_SIMILARITY("functional_similarity");

    private final String wireValue;

    RecommendationStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<RecommendationStrategy> fromWireValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RecommendationStrategy strategy : values()) {
            if (strategy.wireValue.equals(candidate)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
