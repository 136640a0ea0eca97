package net.findmycard.service;

import java.util.Set;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.service.event.CatalogRefreshedEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PopularCardTrackerTest {

    private static final CardIdentityKey SHOCK = CardIdentityKey.oracle("o-shock");
    private static final CardIdentityKey BOLT = CardIdentityKey.oracle("o-bolt");
    private static final CardIdentityKey OPT = CardIdentityKey.oracle("o-opt");

    @Test
    void should_OrderByCountThenKey_When_ListingTopKeys() {
        PopularCardTracker tracker = new PopularCardTracker();
        tracker.record(SHOCK);
        tracker.record(OPT);
        tracker.record(BOLT);
        tracker.record(BOLT);

        assertThat(tracker.topKeys(3)).containsExactly(BOLT, OPT, SHOCK);
        assertThat(tracker.topKeys(1)).containsExactly(BOLT);
        assertThat(tracker.topKeys(0)).isEmpty();
        assertThat(tracker.countFor(BOLT)).isEqualTo(2L);
    }

    @Test
    void should_ResetCounts_When_CatalogFullyReplaced() {
        PopularCardTracker tracker = new PopularCardTracker();
        tracker.record(SHOCK);

        tracker.onCatalogRefreshed(new CatalogRefreshedEvent(Set.of(SHOCK), false, 2L));
        assertThat(tracker.countFor(SHOCK)).isEqualTo(1L);

        tracker.onCatalogRefreshed(new CatalogRefreshedEvent(Set.of(), true, 3L));
        assertThat(tracker.countFor(SHOCK)).isZero();
        assertThat(tracker.topKeys(5)).isEmpty();
    }
}
