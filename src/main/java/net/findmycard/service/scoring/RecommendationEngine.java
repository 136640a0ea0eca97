package net.findmycard.service.scoring;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.findmycard.model.CardIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ranks catalog candidates against a source identity with the requested strategy.
 *
 * <p>The source identity is never scored against itself, candidates scoring 0 are
 * dropped, and the result follows {@link Recommendation#RANKING}.</p>
 */
@Component
public class RecommendationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

    private final Map<RecommendationStrategy, ScoringStrategy> strategies;

    public RecommendationEngine(List<ScoringStrategy> scoringStrategies) {
        Map<RecommendationStrategy, ScoringStrategy> byVariant = new EnumMap<>(RecommendationStrategy.class);
        for (ScoringStrategy scoringStrategy : scoringStrategies) {
            ScoringStrategy previous = byVariant.put(scoringStrategy.strategy(), scoringStrategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scoring strategy for " + scoringStrategy.strategy());
            }
        }
        for (RecommendationStrategy variant : RecommendationStrategy.values()) {
            if (!byVariant.containsKey(variant)) {
                throw new IllegalStateException("No scoring strategy registered for " + variant);
            }
        }
        this.strategies = byVariant;
    }

    public List<Recommendation> rank(CardIdentity source,
                                     List<CardIdentity> candidates,
                                     RecommendationStrategy strategy) {
        ScoringStrategy scorer = strategies.get(strategy);
        List<Recommendation> ranked = new ArrayList<>();
        for (CardIdentity candidate : candidates) {
            if (candidate.key().equals(source.key())) {
                continue;
            }
            ScoreResult result = scorer.score(source, candidate);
            if (result.score() > 0.0) {
                ranked.add(new Recommendation(candidate, result.score(), result.reason()));
            }
        }
        ranked.sort(Recommendation.RANKING);
        log.debug("Ranked {} of {} candidates for {} using {}",
            ranked.size(), candidates.size(), source.key(), strategy.wireValue());
        return List.copyOf(ranked);
    }
}
