package net.findmycard.service.scoring;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import net.findmycard.config.ScoringWeightsProperties;
import net.findmycard.model.CardIdentity;
import org.springframework.stereotype.Component;

/**
 * Scores how well a candidate could stand in for the source card.
 *
 * <p>The score is the weighted sum of five signals in {@code [0, 1]}: type-line token
 * overlap, mana value proximity, color identity overlap, keyword overlap and functional
 * role overlap. A candidate sharing every attribute with the source scores 1.</p>
 */
@Component
public class FunctionalSimilarityScorer implements ScoringStrategy {

    private final ScoringWeightsProperties.Functional weights;

    public FunctionalSimilarityScorer(ScoringWeightsProperties weightsProperties) {
        this.weights = weightsProperties.getFunctional();
    }

    @Override
    public RecommendationStrategy strategy() {
        return RecommendationStrategy.FUNCTIONAL_SIMILARITY;
    }

    @Override
    public ScoreResult score(CardIdentity source, CardIdentity candidate) {
        return score(CardTraits.of(source), CardTraits.of(candidate));
    }

    ScoreResult score(CardTraits source, CardTraits candidate) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        contributions.put("type", weights.getTypeOverlap()
            * SetSimilarity.jaccard(source.typeLine().allTokens(), candidate.typeLine().allTokens()));
        contributions.put("mana value", weights.getManaValue()
            * manaValueProximity(source.manaValue(), candidate.manaValue()));
        contributions.put("color identity", weights.getColorIdentity()
            * SetSimilarity.jaccard(source.colorIdentity(), candidate.colorIdentity()));
        contributions.put("keywords", weights.getKeywords()
            * SetSimilarity.jaccard(source.keywords(), candidate.keywords()));
        contributions.put("role", weights.getFunctionalRole()
            * SetSimilarity.jaccard(source.roles(), candidate.roles()));

        double total = 0.0;
        String dominant = null;
        double dominantValue = 0.0;
        for (Map.Entry<String, Double> entry : contributions.entrySet()) {
            total += entry.getValue();
            if (entry.getValue() > dominantValue) {
                dominantValue = entry.getValue();
                dominant = entry.getKey();
            }
        }
        if (dominant == null) {
            return ScoreResult.NONE;
        }
        return ScoreResult.bounded(total, describe(dominant, source, candidate));
    }

    static double manaValueProximity(double left, double right) {
        return 1.0 / (1.0 + Math.abs(left - right));
    }

    private static String describe(String signal, CardTraits source, CardTraits candidate) {
        return switch (signal) {
            case "type" -> sharedOrSimilar("similar type line", source.typeLine().allTokens(), candidate.typeLine().allTokens());
            case "mana value" -> source.manaValue() == candidate.manaValue() ? "same mana value" : "similar mana value";
            case "color identity" -> "similar color identity";
            case "keywords" -> sharedOrSimilar("shared keywords", source.keywords(), candidate.keywords());
            case "role" -> {
                String roles = source.roles().stream()
                    .filter(candidate.roles()::contains)
                    .map(FunctionalRole::label)
                    .collect(Collectors.joining(", "));
                yield roles.isEmpty() ? "similar function" : "same role: " + roles;
            }
            default -> signal;
        };
    }

    private static String sharedOrSimilar(String prefix, Set<String> left, Set<String> right) {
        String shared = left.stream()
            .filter(right::contains)
            .sorted()
            .collect(Collectors.joining(", "));
        return shared.isEmpty() ? prefix : prefix + ": " + shared;
    }
}
