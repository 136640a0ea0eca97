package net.findmycard.scheduler;

import net.findmycard.exception.CatalogUnavailableException;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.service.PopularCardTracker;
import net.findmycard.service.RecommendationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecommendationWarmupSchedulerTest {

    private static final CardIdentityKey BOLT = CardIdentityKey.oracle("o-bolt");
    private static final CardIdentityKey SHOCK = CardIdentityKey.oracle("o-shock");
    private static final CardIdentityKey OPT = CardIdentityKey.oracle("o-opt");

    @Mock
    private RecommendationService recommendationService;

    private PopularCardTracker tracker;
    private RecommendationWarmupScheduler scheduler;

    @BeforeEach
    void setUp() {
        tracker = new PopularCardTracker();
        scheduler = new RecommendationWarmupScheduler(tracker, recommendationService);
        ReflectionTestUtils.setField(scheduler, "warmupEnabled", true);
        ReflectionTestUtils.setField(scheduler, "maxCardsPerRun", 2);
    }

    @Test
    void should_WarmMostRequestedCardsFirst() {
        tracker.record(OPT);
        tracker.record(BOLT);
        tracker.record(BOLT);
        tracker.record(SHOCK);
        tracker.record(SHOCK);
        tracker.record(SHOCK);
        when(recommendationService.warm(any())).thenReturn(2);

        scheduler.warmPopularRecommendations();

        verify(recommendationService).warm(SHOCK);
        verify(recommendationService).warm(BOLT);
        verify(recommendationService, never()).warm(OPT);
        assertThat(tracker.topKeys(3)).containsExactly(SHOCK, BOLT, OPT);
    }

    @Test
    void should_ContinueAfterSingleFailure_But_StopWhenCatalogIsDown() {
        tracker.record(SHOCK);
        tracker.record(SHOCK);
        tracker.record(BOLT);
        when(recommendationService.warm(SHOCK)).thenThrow(new IllegalStateException("scorer bug"));
        when(recommendationService.warm(BOLT)).thenThrow(new CatalogUnavailableException("down", new RuntimeException()));

        scheduler.warmPopularRecommendations();

        verify(recommendationService).warm(BOLT);
    }

    @Test
    void should_SkipRun_When_Disabled() {
        ReflectionTestUtils.setField(scheduler, "warmupEnabled", false);
        tracker.record(SHOCK);

        scheduler.warmPopularRecommendations();

        verify(recommendationService, never()).warm(any());
    }
}
