package net.findmycard.service.scoring;

import net.findmycard.model.CardIdentity;

/**
 * One scoring function per {@link RecommendationStrategy}.
 * Implementations are pure: the same pair always yields the same result.
 */
public interface ScoringStrategy {

    RecommendationStrategy strategy();

    ScoreResult score(CardIdentity source, CardIdentity candidate);
}
