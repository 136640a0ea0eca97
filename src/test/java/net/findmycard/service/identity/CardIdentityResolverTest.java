package net.findmycard.service.identity;

import net.findmycard.exception.CardNotFoundException;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.catalog.CatalogSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static net.findmycard.testutil.CardTestData.printing;
import static net.findmycard.testutil.CardTestData.snapshotOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class CardIdentityResolverTest {

    @Mock
    private CardCatalogStore catalogStore;

    private CardIdentityResolver resolver;
    private CatalogSnapshot snapshot;

    @BeforeEach
    void setUp() {
        resolver = new CardIdentityResolver(catalogStore);
        snapshot = snapshotOf(
            printing("p-shock", "Shock").oracleId("o-shock").text("Shock deals 2 damage to any target.").build(),
            printing("p-mystery", "Mystery Card").text("Draw a card.").build());
    }

    @Test
    void should_ResolvePrintingIdAndOracleIdToSameKey() {
        assertThat(resolver.resolve("p-shock", snapshot)).isEqualTo(CardIdentityKey.oracle("o-shock"));
        assertThat(resolver.resolve("o-shock", snapshot)).isEqualTo(CardIdentityKey.oracle("o-shock"));
    }

    @Test
    void should_ResolveDerivedKeyString_When_ReferenceIsWireForm() {
        CardIdentityKey derived = resolver.resolve("p-mystery", snapshot);

        assertThat(resolver.resolve(derived.toString(), snapshot)).isEqualTo(derived);
    }

    @Test
    void should_BuildPathSafeDerivedKey_When_CardHasSeveralFaces() {
        CatalogSnapshot withSplitCard = snapshotOf(
            printing("p-fire", "Fire // Ice").typeLine("Instant // Instant")
                .face("Fire", "Instant", "Fire deals 2 damage divided as you choose among one or two targets.")
                .face("Ice", "Instant", "Tap target permanent. Draw a card.").build());

        CardIdentityKey derived = resolver.resolve("p-fire", withSplitCard);

        assertThat(derived.kind()).isEqualTo(CardIdentityKey.Kind.DERIVED);
        assertThat(derived.toString()).startsWith("derived:fire-ice:").doesNotContain("/");
        assertThat(resolver.resolve(derived.toString(), withSplitCard)).isEqualTo(derived);
    }

    @Test
    void should_BeIdempotent_When_ResolvingTheResolvedKey() {
        CardIdentityKey first = resolver.resolve("p-shock", snapshot);

        assertThat(resolver.resolve(first.toString(), snapshot)).isEqualTo(first);
    }

    @Test
    void should_ThrowNotFound_When_ReferenceUnknown() {
        assertThatThrownBy(() -> resolver.resolve("nope", snapshot))
            .isInstanceOf(CardNotFoundException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void should_FallBackToOwnKey_When_PrintingNotInSnapshot() {
        CardPrinting fresh = printing("p-new", "Brand New").text("Flying").build();

        CardIdentityKey key = resolver.resolve(fresh, snapshot);

        assertThat(key).isEqualTo(IdentityFingerprint.of(fresh).toDerivedKey());
    }
}
