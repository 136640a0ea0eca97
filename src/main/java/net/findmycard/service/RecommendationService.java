package net.findmycard.service;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import net.findmycard.config.CacheTierProperties;
import net.findmycard.exception.CardNotFoundException;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.service.cache.CacheCoordinator;
import net.findmycard.service.cache.CacheKeys;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.catalog.CatalogSnapshot;
import net.findmycard.service.filter.CardFilterPipeline;
import net.findmycard.service.identity.CardIdentityResolver;
import net.findmycard.service.image.CardImagePreloader;
import net.findmycard.service.scoring.Recommendation;
import net.findmycard.service.scoring.RecommendationEngine;
import net.findmycard.service.scoring.RecommendationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Resolves the source card, ranks the catalog against it and applies filters and limit.
 *
 * <p>The unfiltered ranking per source and strategy is cached through the
 * {@link CacheCoordinator}; filters and limit always run on top of it, so one cached
 * ranking serves every filter combination and a filter can never starve the limit.</p>
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    private final CardCatalogStore catalogStore;
    private final CardIdentityResolver identityResolver;
    private final RecommendationEngine recommendationEngine;
    private final CardFilterPipeline filterPipeline;
    private final CacheCoordinator cacheCoordinator;
    private final CardImagePreloader imagePreloader;
    private final PopularCardTracker popularCardTracker;
    private final Duration rankingTtl;
    private final JavaType rankingType;

    public RecommendationService(CardCatalogStore catalogStore,
                                 CardIdentityResolver identityResolver,
                                 RecommendationEngine recommendationEngine,
                                 CardFilterPipeline filterPipeline,
                                 CacheCoordinator cacheCoordinator,
                                 CardImagePreloader imagePreloader,
                                 PopularCardTracker popularCardTracker,
                                 CacheTierProperties cacheProperties,
                                 ObjectMapper objectMapper) {
        this.catalogStore = catalogStore;
        this.identityResolver = identityResolver;
        this.recommendationEngine = recommendationEngine;
        this.filterPipeline = filterPipeline;
        this.cacheCoordinator = cacheCoordinator;
        this.imagePreloader = imagePreloader;
        this.popularCardTracker = popularCardTracker;
        this.rankingTtl = cacheProperties.getTtl().getRecommendations();
        this.rankingType = objectMapper.getTypeFactory().constructCollectionType(List.class, Recommendation.class);
    }

    /**
     * Reactive entry point for controllers; the work runs on the bounded elastic scheduler.
     */
    public Mono<List<Recommendation>> recommend(RecommendationRequest request) {
        return Mono.fromCallable(() -> recommendNow(request))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * @throws CardNotFoundException when the source reference matches no card
     */
    public List<Recommendation> recommendNow(RecommendationRequest request) {
        CatalogSnapshot snapshot = catalogStore.snapshot();
        CardIdentityKey sourceKey = identityResolver.resolve(request.sourceCardRef(), snapshot);
        CardIdentity source = snapshot.getByKey(sourceKey)
            .orElseThrow(() -> new CardNotFoundException(request.sourceCardRef()));
        popularCardTracker.record(sourceKey);

        List<Recommendation> ranked = ranking(source, request.strategy(), snapshot);
        List<Recommendation> filtered = filterPipeline.apply(ranked, request.filters());
        int limit = request.effectiveLimit();
        List<Recommendation> result = filtered.size() > limit ? List.copyOf(filtered.subList(0, limit)) : filtered;

        imagePreloader.preloadResultImages(imageUrls(result, snapshot));
        log.debug("Recommendations for {} ({}) requested by {}: {} ranked, {} after filters, {} returned",
            sourceKey, request.strategy().wireValue(),
            request.requesterId() == null ? "anonymous" : request.requesterId(),
            ranked.size(), filtered.size(), result.size());
        return result;
    }

    /**
     * Computes and caches the rankings of {@code key} for every strategy.
     *
     * @return number of strategies warmed, 0 when the key no longer exists
     */
    public int warm(CardIdentityKey key) {
        CatalogSnapshot snapshot = catalogStore.snapshot();
        return snapshot.getByKey(key)
            .map(source -> {
                for (RecommendationStrategy strategy : RecommendationStrategy.values()) {
                    ranking(source, strategy, snapshot);
                }
                return RecommendationStrategy.values().length;
            })
            .orElse(0);
    }

    private List<Recommendation> ranking(CardIdentity source, RecommendationStrategy strategy, CatalogSnapshot snapshot) {
        return cacheCoordinator.getOrCompute(
            CacheKeys.recommendations(source.key(), strategy),
            rankingType,
            rankingTtl,
            CacheKeys.recommendationTags(source.key()),
            () -> recommendationEngine.rank(source, snapshot.listIdentities(), strategy),
            () -> catalogStore.currentVersion() == snapshot.version());
    }

    private static List<String> imageUrls(List<Recommendation> recommendations, CatalogSnapshot snapshot) {
        List<String> urls = new ArrayList<>(recommendations.size());
        for (Recommendation recommendation : recommendations) {
            snapshot.representativeOf(recommendation.candidate().key())
                .flatMap(CardPrinting::primaryImageUrl)
                .ifPresent(urls::add);
        }
        return urls;
    }
}
