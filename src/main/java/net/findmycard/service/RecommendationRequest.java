package net.findmycard.service;

import net.findmycard.exception.InvalidRequestException;
import net.findmycard.service.filter.CardFilters;
import net.findmycard.service.scoring.RecommendationStrategy;
import net.findmycard.util.ValidationUtils;

/**
 * One recommendation query.
 *
 * @param sourceCardRef printing id, oracle id or derived identity key of the source card
 * @param strategy scoring strategy
 * @param limit maximum results after filtering; null means {@link RecommendationService#DEFAULT_LIMIT}
 * @param filters facets applied after ranking; null means none
 * @param requesterId id of the calling user, carried for logging and popularity only; may be null
 */
public record RecommendationRequest(String sourceCardRef,
                                    RecommendationStrategy strategy,
                                    Integer limit,
                                    CardFilters filters,
                                    String requesterId) {

    public RecommendationRequest {
        if (!ValidationUtils.hasText(sourceCardRef)) {
            throw new InvalidRequestException("sourceCardRef is required");
        }
        if (strategy == null) {
            throw new InvalidRequestException("strategy is required");
        }
        if (limit != null && limit <= 0) {
            throw new InvalidRequestException("limit must be a positive integer");
        }
        sourceCardRef = sourceCardRef.trim();
        filters = filters == null ? CardFilters.NONE : filters;
        requesterId = ValidationUtils.trimToNull(requesterId);
    }

    public int effectiveLimit() {
        return limit == null ? RecommendationService.DEFAULT_LIMIT : Math.min(limit, RecommendationService.MAX_LIMIT);
    }
}
