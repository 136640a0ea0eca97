package net.findmycard.scheduler;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.findmycard.exception.CatalogUnavailableException;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.service.PopularCardTracker;
import net.findmycard.service.RecommendationService;
import net.findmycard.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Precomputes rankings for the most requested cards
 * - Runs on a fixed delay after the previous run finishes
 * - Only ranks; filters and limits still apply per request
 * - A purge between runs is refilled on the next run
 */
@Component
@Slf4j
public class RecommendationWarmupScheduler {

    private final PopularCardTracker popularCardTracker;
    private final RecommendationService recommendationService;

    @Value("${app.recommendations.warmup.enabled:true}")
    private boolean warmupEnabled;

    @Value("${app.recommendations.warmup.max-cards-per-run:25}")
    private int maxCardsPerRun;

    public RecommendationWarmupScheduler(PopularCardTracker popularCardTracker,
                                         RecommendationService recommendationService) {
        this.popularCardTracker = popularCardTracker;
        this.recommendationService = recommendationService;
    }

    @Scheduled(fixedDelayString = "${app.recommendations.warmup.interval:PT10M}",
               initialDelayString = "${app.recommendations.warmup.initial-delay:PT2M}")
    public void warmPopularRecommendations() {
        if (!warmupEnabled) {
            log.debug("Recommendation warmup is disabled");
            return;
        }
        List<CardIdentityKey> keys = popularCardTracker.topKeys(maxCardsPerRun);
        if (keys.isEmpty()) {
            log.debug("No requested cards to warm");
            return;
        }
        int warmed = 0;
        for (CardIdentityKey key : keys) {
            try {
                warmed += recommendationService.warm(key) > 0 ? 1 : 0;
            } catch (CatalogUnavailableException ex) {
                LoggingUtils.warn(log, ex, "Catalog unavailable; aborting recommendation warmup after {} cards", warmed);
                return;
            } catch (RuntimeException ex) {
                LoggingUtils.error(log, ex, "Recommendation warmup failed for {}", key);
            }
        }
        log.info("Warmed recommendation rankings for {} of {} popular cards", warmed, keys.size());
    }
}
