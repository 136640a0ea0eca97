package net.findmycard.service.scoring;

/**
 * Pairwise relevance of a candidate to a source card.
 *
 * @param score relevance in {@code [0, 1]}
 * @param reason short human-readable explanation naming the dominant signal
 */
public record ScoreResult(double score, String reason) {

    public static final ScoreResult NONE = new ScoreResult(0.0, "no shared traits");

    public ScoreResult {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must lie in [0, 1] but was " + score);
        }
        reason = reason == null ? "" : reason;
    }

    /** Clamps accumulated floating point error back into {@code [0, 1]}. */
    static ScoreResult bounded(double rawScore, String reason) {
        double clamped = Math.max(0.0, Math.min(1.0, rawScore));
        return new ScoreResult(clamped, reason);
    }
}
