package net.findmycard.controller.dto;

/**
 * One recommended card with its score in [0, 1] and a short human-readable reason.
 */
public record RecommendationDto(CardDto card, double score, String reason) {
}
