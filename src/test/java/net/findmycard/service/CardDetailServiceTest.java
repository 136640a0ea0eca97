package net.findmycard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import net.findmycard.config.CacheFactory;
import net.findmycard.config.CacheTierProperties;
import net.findmycard.exception.CardNotFoundException;
import net.findmycard.service.cache.CacheCoordinator;
import net.findmycard.service.cache.HotCacheTier;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.catalog.CatalogSnapshot;
import net.findmycard.service.identity.CardIdentityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import static net.findmycard.testutil.CardTestData.printing;
import static net.findmycard.testutil.CardTestData.snapshotOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CardDetailServiceTest {

    private static final CatalogSnapshot SNAPSHOT = snapshotOf(
        printing("p-opt-xln", "Opt").oracleId("o-opt").set("xln").text("Scry 1. Draw a card.").build(),
        printing("p-opt-dom", "Opt").oracleId("o-opt").set("dom").text("Scry 1. Draw a card.").build());

    @Mock
    private CardCatalogStore catalogStore;

    private CardDetailService service;

    @BeforeEach
    void setUp() {
        lenient().when(catalogStore.currentVersion()).thenReturn(1L);
        Clock clock = Clock.systemUTC();
        service = new CardDetailService(catalogStore, new CardIdentityResolver(catalogStore),
            new CacheCoordinator(List.of(new HotCacheTier(new CacheFactory(), 10, clock)), clock),
            new ObjectMapper(), new CacheTierProperties());
    }

    @Test
    void should_ReturnSameCardWithEveryPrinting_When_ReferencedByAnyPrinting() {
        when(catalogStore.snapshot()).thenReturn(SNAPSHOT);

        CardDetail byXln = service.findCardNow("p-opt-xln");
        CardDetail byDom = service.findCardNow("p-opt-dom");
        CardDetail byOracle = service.findCardNow("o-opt");

        assertThat(byXln.identity().key()).isEqualTo(byDom.identity().key()).isEqualTo(byOracle.identity().key());
        assertThat(byXln.printings()).hasSize(2);
        assertThat(byXln.identity().setCodes()).containsExactlyInAnyOrder("xln", "dom");
    }

    @Test
    void should_EmitNotFound_When_ReferenceIsUnknown() {
        when(catalogStore.snapshot()).thenReturn(SNAPSHOT);

        StepVerifier.create(service.findCard("p-missing"))
            .expectError(CardNotFoundException.class)
            .verify();
    }
}
