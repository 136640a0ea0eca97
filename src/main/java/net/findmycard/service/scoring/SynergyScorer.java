package net.findmycard.service.scoring;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import net.findmycard.config.ScoringWeightsProperties;
import net.findmycard.model.CardIdentity;
import org.springframework.stereotype.Component;

/**
 * Scores how well a candidate plays alongside the source card.
 *
 * <p>The main signal is cross-reference density: how often one card's rules text names
 * the other card's subtypes, keywords or card types, checked in both directions. Matched
 * enabler/payoff patterns add to it and a color identity compatibility term breaks near
 * ties. A pair with neither cross-references nor patterns scores 0 whatever its colors.</p>
 */
@Component
public class SynergyScorer implements ScoringStrategy {

    static final double SUBTYPE_REFERENCE = 1.0;
    static final double KEYWORD_REFERENCE = 0.6;
    static final double CARD_TYPE_REFERENCE = 0.4;

    private final ScoringWeightsProperties.Synergy weights;

    public SynergyScorer(ScoringWeightsProperties weightsProperties) {
        this.weights = weightsProperties.getSynergy();
    }

    @Override
    public RecommendationStrategy strategy() {
        return RecommendationStrategy.SYNERGY;
    }

    @Override
    public ScoreResult score(CardIdentity source, CardIdentity candidate) {
        return score(CardTraits.of(source), CardTraits.of(candidate));
    }

    ScoreResult score(CardTraits source, CardTraits candidate) {
        // Keyed by term so ties between equally weighted references resolve alphabetically.
        Map<String, Double> references = new TreeMap<>();
        collectReferences(source.text(), candidate, references);
        collectReferences(candidate.text(), source, references);
        double referenceDensity = saturate(references.values().stream().mapToDouble(Double::doubleValue).sum());

        double patternStrength = 0.0;
        SynergyPattern strongestPattern = null;
        for (SynergyPattern pattern : SynergyPattern.values()) {
            boolean matched = pattern.matches(source, candidate) || pattern.matches(candidate, source);
            if (matched) {
                patternStrength += pattern.strength();
                if (strongestPattern == null || pattern.strength() > strongestPattern.strength()) {
                    strongestPattern = pattern;
                }
            }
        }
        patternStrength = Math.min(1.0, patternStrength);

        if (references.isEmpty() && strongestPattern == null) {
            return ScoreResult.NONE;
        }

        double colorCompatibility = SetSimilarity.containment(candidate.colorIdentity(), source.colorIdentity());
        double referenceContribution = weights.getCrossReference() * referenceDensity;
        double patternContribution = weights.getEnablerPayoff() * patternStrength;
        double total = referenceContribution
            + patternContribution
            + weights.getColorCompatibility() * colorCompatibility;

        boolean referencesDominate = !references.isEmpty()
            && (strongestPattern == null || referenceContribution >= patternContribution);
        String reason = referencesDominate
            ? "references " + strongestReference(references)
            : strongestPattern.reason();
        return ScoreResult.bounded(total, reason);
    }

    /**
     * Maps an unbounded reference weight onto {@code [0, 1)}: one subtype reference gives 0.5.
     */
    static double saturate(double raw) {
        return raw <= 0.0 ? 0.0 : raw / (raw + 1.0);
    }

    private static void collectReferences(String text, CardTraits referenced, Map<String, Double> references) {
        if (text.isEmpty()) {
            return;
        }
        for (String subtype : referenced.typeLine().subtypes()) {
            if (mentions(text, subtype)) {
                references.merge(subtype, SUBTYPE_REFERENCE, Math::max);
            }
        }
        for (String keyword : referenced.keywords()) {
            if (mentions(text, keyword)) {
                references.merge(keyword, KEYWORD_REFERENCE, Math::max);
            }
        }
        for (String cardType : referenced.typeLine().cardTypes()) {
            if (mentions(text, cardType)) {
                references.merge(cardType, CARD_TYPE_REFERENCE, Math::max);
            }
        }
    }

    private static String strongestReference(Map<String, Double> references) {
        String best = null;
        double bestWeight = -1.0;
        for (Map.Entry<String, Double> entry : references.entrySet()) {
            if (entry.getValue() > bestWeight) {
                best = entry.getKey();
                bestWeight = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Whole-word match allowing regular plurals, so "human" matches "Humans" and "elf" matches "elves".
     */
    static boolean mentions(String text, String term) {
        StringBuilder alternatives = new StringBuilder(Pattern.quote(term)).append("(?:s|es)?");
        if (term.endsWith("f")) {
            alternatives.append('|').append(Pattern.quote(term.substring(0, term.length() - 1))).append("ves");
        }
        return Pattern.compile("\\b(?:" + alternatives + ")\\b").matcher(text).find();
    }
}
