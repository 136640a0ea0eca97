package net.findmycard.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Weights of the recommendation scoring signals.
 *
 * <p>Each strategy's final score is a convex combination of its signals, so every
 * weight must be non-negative and each group must sum to 1. Rankings are what the
 * weights tune; absolute scores are not meant to be compared across strategies.</p>
 */
@Component
@ConfigurationProperties(prefix = "app.recommendations.weights")
public class ScoringWeightsProperties {

    private static final double SUM_TOLERANCE = 1e-6;

    private final Functional functional = new Functional();
    private final Synergy synergy = new Synergy();

    @PostConstruct
    void validate() {
        functional.validate();
        synergy.validate();
    }

    public Functional getFunctional() {
        return functional;
    }

    public Synergy getSynergy() {
        return synergy;
    }

    /**
     * Signals of the functional-similarity strategy.
     */
    public static class Functional {
        /** Jaccard overlap of type-line tokens. */
        private double typeOverlap = 0.30;
        /** Mana value proximity, {@code 1 / (1 + |difference|)}. */
        private double manaValue = 0.20;
        /** Jaccard overlap of color identities. */
        private double colorIdentity = 0.20;
        /** Jaccard overlap of keyword abilities. */
        private double keywords = 0.10;
        /** Jaccard overlap of detected functional roles (removal, card draw, ...). */
        private double functionalRole = 0.20;

        void validate() {
            requireConvex("app.recommendations.weights.functional",
                typeOverlap, manaValue, colorIdentity, keywords, functionalRole);
        }

        public double getTypeOverlap() {
            return typeOverlap;
        }

        public void setTypeOverlap(double typeOverlap) {
            this.typeOverlap = typeOverlap;
        }

        public double getManaValue() {
            return manaValue;
        }

        public void setManaValue(double manaValue) {
            this.manaValue = manaValue;
        }

        public double getColorIdentity() {
            return colorIdentity;
        }

        public void setColorIdentity(double colorIdentity) {
            this.colorIdentity = colorIdentity;
        }

        public double getKeywords() {
            return keywords;
        }

        public void setKeywords(double keywords) {
            this.keywords = keywords;
        }

        public double getFunctionalRole() {
            return functionalRole;
        }

        public void setFunctionalRole(double functionalRole) {
            this.functionalRole = functionalRole;
        }
    }

    /**
     * Signals of the synergy strategy.
     */
    public static class Synergy {
        /** Density of references between one card's rules text and the other card's traits. */
        private double crossReference = 0.60;
        /** Matched enabler/payoff patterns. */
        private double enablerPayoff = 0.25;
        /** Share of the candidate's color identity castable alongside the source. */
        private double colorCompatibility = 0.15;

        void validate() {
            requireConvex("app.recommendations.weights.synergy",
                crossReference, enablerPayoff, colorCompatibility);
        }

        public double getCrossReference() {
            return crossReference;
        }

        public void setCrossReference(double crossReference) {
            this.crossReference = crossReference;
        }

        public double getEnablerPayoff() {
            return enablerPayoff;
        }

        public void setEnablerPayoff(double enablerPayoff) {
            this.enablerPayoff = enablerPayoff;
        }

        public double getColorCompatibility() {
            return colorCompatibility;
        }

        public void setColorCompatibility(double colorCompatibility) {
            this.colorCompatibility = colorCompatibility;
        }
    }

    private static void requireConvex(String prefix, double... weights) {
        double sum = 0.0;
        for (double weight : weights) {
            Assert.isTrue(weight >= 0.0 && Double.isFinite(weight), prefix + ".* weights must be non-negative");
            sum += weight;
        }
        Assert.isTrue(Math.abs(sum - 1.0) <= SUM_TOLERANCE, prefix + ".* weights must sum to 1 but sum to " + sum);
    }
}
