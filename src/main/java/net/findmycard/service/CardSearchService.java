package net.findmycard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import net.findmycard.config.CacheTierProperties;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardPrinting;
import net.findmycard.service.cache.CacheCoordinator;
import net.findmycard.service.cache.CacheKeys;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.catalog.CatalogSnapshot;
import net.findmycard.service.filter.CardFilterPipeline;
import net.findmycard.service.image.CardImagePreloader;
import net.findmycard.util.CardTextNormalizer;
import net.findmycard.util.PagingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Text and facet search over deduplicated identities.
 *
 * <p>Every identity appears at most once regardless of how many printings match, and
 * pages are cut from the name-ordered result so consecutive pages never overlap.</p>
 */
@Service
public class CardSearchService {

    private static final Logger log = LoggerFactory.getLogger(CardSearchService.class);

    private final CardCatalogStore catalogStore;
    private final CardFilterPipeline filterPipeline;
    private final CacheCoordinator cacheCoordinator;
    private final CardImagePreloader imagePreloader;
    private final ObjectMapper objectMapper;
    private final Duration searchTtl;

    public CardSearchService(CardCatalogStore catalogStore,
                             CardFilterPipeline filterPipeline,
                             CacheCoordinator cacheCoordinator,
                             CardImagePreloader imagePreloader,
                             ObjectMapper objectMapper,
                             CacheTierProperties cacheProperties) {
        this.catalogStore = catalogStore;
        this.filterPipeline = filterPipeline;
        this.cacheCoordinator = cacheCoordinator;
        this.imagePreloader = imagePreloader;
        this.objectMapper = objectMapper;
        this.searchTtl = cacheProperties.getTtl().getSearch();
    }

    public Mono<CardSearchPage> search(CardSearchRequest request) {
        return Mono.fromCallable(() -> searchNow(request))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public CardSearchPage searchNow(CardSearchRequest request) {
        // the snapshot is only pinned on a miss, so cache hits never touch the catalog
        AtomicLong computedVersion = new AtomicLong(-1L);
        CardSearchPage page = cacheCoordinator.getOrCompute(
            CacheKeys.search(request.query(), request.filters(), request.page(), request.pageSize()),
            objectMapper.constructType(CardSearchPage.class),
            searchTtl,
            CacheKeys.searchTags(),
            () -> {
                CatalogSnapshot snapshot = catalogStore.snapshot();
                computedVersion.set(snapshot.version());
                return compute(request, snapshot);
            },
            () -> catalogStore.currentVersion() == computedVersion.get());
        imagePreloader.preloadResultImages(page.data().stream()
            .map(hit -> hit.representative().primaryImageUrl().orElse(null))
            .toList());
        return page;
    }

    private CardSearchPage compute(CardSearchRequest request, CatalogSnapshot snapshot) {
        List<CardIdentity> matches = filterPipeline.applyToIdentities(
            queryMatches(snapshot.listIdentities(), request.query()), request.filters());
        List<CardSearchHit> hits = new ArrayList<>();
        for (CardIdentity identity : PagingUtils.page(matches, request.page(), request.pageSize())) {
            CardPrinting representative = snapshot.representativeOf(identity.key())
                .orElseThrow(() -> new IllegalStateException("Identity " + identity.key() + " has no printings"));
            hits.add(new CardSearchHit(identity, representative));
        }
        boolean hasMore = PagingUtils.hasMore(matches.size(), request.page(), request.pageSize());
        log.debug("Search '{}' page {} matched {} identities", request.query(), request.page(), matches.size());
        return new CardSearchPage(hits, hasMore, matches.size(), request.page(), hasMore ? request.page() + 1 : null);
    }

    /**
     * Identities whose name, rules text or type line contains the normalized query.
     */
    private static List<CardIdentity> queryMatches(List<CardIdentity> identities, String normalizedQuery) {
        if (normalizedQuery.isEmpty()) {
            return identities;
        }
        return identities.stream()
            .filter(identity -> matchesQuery(identity, normalizedQuery))
            .toList();
    }

    private static boolean matchesQuery(CardIdentity identity, String normalizedQuery) {
        return CardTextNormalizer.normalizeName(identity.name()).contains(normalizedQuery)
            || CardTextNormalizer.normalizeName(identity.oracleText()).contains(normalizedQuery)
            || CardTextNormalizer.normalizeName(identity.typeLine()).contains(normalizedQuery);
    }
}
