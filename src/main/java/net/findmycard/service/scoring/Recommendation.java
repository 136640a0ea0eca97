package net.findmycard.service.scoring;

import java.util.Comparator;
import net.findmycard.model.CardIdentity;

/**
 * A scored candidate for a recommendation request.
 */
public record Recommendation(CardIdentity candidate, double score, String reason) {

    /** Score descending, then candidate name ascending, then key for a total order. */
    public static final Comparator<Recommendation> RANKING = Comparator
        .comparingDouble(Recommendation::score).reversed()
        .thenComparing(recommendation -> recommendation.candidate().name())
        .thenComparing(recommendation -> recommendation.candidate().key());
}
