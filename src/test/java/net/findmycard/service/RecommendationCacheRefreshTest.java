package net.findmycard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import net.findmycard.config.CacheFactory;
import net.findmycard.config.CacheTierProperties;
import net.findmycard.config.ScoringWeightsProperties;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardPrinting;
import net.findmycard.model.ManaColor;
import net.findmycard.repository.InMemoryCardPrintingRepository;
import net.findmycard.service.cache.CacheCoordinator;
import net.findmycard.service.cache.CacheInvalidationListener;
import net.findmycard.service.cache.HotCacheTier;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.event.CatalogMutationEvent;
import net.findmycard.service.event.CatalogRefreshedEvent;
import net.findmycard.service.filter.CardFilterPipeline;
import net.findmycard.service.identity.CardIdentityResolver;
import net.findmycard.service.image.CardImagePreloader;
import net.findmycard.service.scoring.FunctionalSimilarityScorer;
import net.findmycard.service.scoring.Recommendation;
import net.findmycard.service.scoring.RecommendationEngine;
import net.findmycard.service.scoring.RecommendationStrategy;
import net.findmycard.service.scoring.ScoreResult;
import net.findmycard.service.scoring.ScoringStrategy;
import net.findmycard.service.scoring.SynergyScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static net.findmycard.testutil.CardTestData.printing;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wires the real catalog store, invalidation listener and hot tier so a catalog write can
 * land while a ranking is being computed.
 */
@ExtendWith(MockitoExtension.class)
class RecommendationCacheRefreshTest {

    private static final CardPrinting SOURCE = printing("p-source", "Elite Vanguard").oracleId("o-source")
        .typeLine("Creature — Human Soldier").colors(ManaColor.W).manaCost("{W}", 1).build();
    private static final CardPrinting ALPHA = printing("p-alpha", "Alpha Soldier").oracleId("o-alpha")
        .typeLine("Creature — Human Soldier").colors(ManaColor.W).manaCost("{W}", 1).build();
    private static final CardPrinting BETA = printing("p-beta", "Beta Soldier").oracleId("o-beta")
        .typeLine("Creature — Human Soldier").colors(ManaColor.W).manaCost("{W}", 1).build();

    @Mock
    private CardImagePreloader imagePreloader;

    private final InMemoryCardPrintingRepository repository = new InMemoryCardPrintingRepository();
    private final AtomicBoolean writeDuringFirstRanking = new AtomicBoolean(true);
    private CardCatalogStore catalogStore;
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        repository.upsertAll(List.of(SOURCE, ALPHA));
        Clock clock = Clock.systemUTC();
        CacheCoordinator coordinator = new CacheCoordinator(
            List.of(new HotCacheTier(new CacheFactory(), 100, clock)), clock);
        CacheInvalidationListener invalidationListener = new CacheInvalidationListener(coordinator);
        catalogStore = new CardCatalogStore(repository, event -> {
            if (event instanceof CatalogRefreshedEvent) {
                invalidationListener.onCatalogRefreshed((CatalogRefreshedEvent) event);
            }
        });

        ScoringWeightsProperties weights = new ScoringWeightsProperties();
        ScoringStrategy functional = new FunctionalSimilarityScorer(weights);
        ScoringStrategy writingScorer = new ScoringStrategy() {
            @Override
            public RecommendationStrategy strategy() {
                return RecommendationStrategy.FUNCTIONAL_SIMILARITY;
            }

            @Override
            public ScoreResult score(CardIdentity source, CardIdentity candidate) {
                if (writeDuringFirstRanking.getAndSet(false)) {
                    repository.upsertAll(List.of(BETA));
                    catalogStore.onCatalogMutation(
                        new CatalogMutationEvent(CatalogMutationEvent.Kind.UPSERT, Set.of("p-beta"), "admin upsert"));
                }
                return functional.score(source, candidate);
            }
        };

        service = new RecommendationService(
            catalogStore,
            new CardIdentityResolver(catalogStore),
            new RecommendationEngine(List.of(new SynergyScorer(weights), writingScorer)),
            new CardFilterPipeline(),
            coordinator,
            imagePreloader,
            new PopularCardTracker(),
            new CacheTierProperties(),
            new ObjectMapper());
    }

    @Test
    void should_RankNewCard_When_CatalogChangedWhileFirstRankingWasComputed() {
        RecommendationRequest request = new RecommendationRequest(
            "o-source", RecommendationStrategy.FUNCTIONAL_SIMILARITY, null, null, null);

        List<Recommendation> first = service.recommendNow(request);
        List<Recommendation> second = service.recommendNow(request);

        assertThat(first).extracting(r -> r.candidate().name()).containsExactly("Alpha Soldier");
        assertThat(catalogStore.listIdentities()).extracting(CardIdentity::name)
            .containsExactlyInAnyOrder("Alpha Soldier", "Beta Soldier", "Elite Vanguard");
        assertThat(second).extracting(r -> r.candidate().name())
            .containsExactly("Alpha Soldier", "Beta Soldier");
    }
}
