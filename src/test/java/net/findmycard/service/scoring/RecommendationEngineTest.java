package net.findmycard.service.scoring;

import java.util.List;
import net.findmycard.config.ScoringWeightsProperties;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.ManaColor;
import net.findmycard.service.catalog.CatalogSnapshot;
import org.junit.jupiter.api.Test;

import static net.findmycard.testutil.CardTestData.printing;
import static net.findmycard.testutil.CardTestData.snapshotOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecommendationEngineTest {

    private final ScoringWeightsProperties weights = new ScoringWeightsProperties();
    private final RecommendationEngine engine = new RecommendationEngine(
        List.of(new SynergyScorer(weights), new FunctionalSimilarityScorer(weights)));

    @Test
    void should_RankHumansFirst_When_SourceCaresAboutHumans() {
        CatalogSnapshot snapshot = snapshotOf(
            printing("p-champion", "Champion of the Parish").oracleId("o-champion")
                .typeLine("Creature — Human Soldier").colors(ManaColor.W)
                .text("Whenever another Human enters the battlefield under your control, put a +1/+1 counter on Champion of the Parish.")
                .build(),
            printing("p-inspector", "Thraben Inspector").oracleId("o-inspector")
                .typeLine("Creature — Human Soldier").colors(ManaColor.W).build(),
            printing("p-lions", "Savannah Lions").oracleId("o-lions")
                .typeLine("Creature — Cat").colors(ManaColor.W)
                .text("When Savannah Lions enters the battlefield, return target card from your graveyard to your hand.")
                .build());
        CardIdentity source = snapshot.getByKey(snapshot.keyForPrinting("p-champion").orElseThrow()).orElseThrow();

        List<Recommendation> ranked = engine.rank(source, snapshot.listIdentities(), RecommendationStrategy.SYNERGY);

        assertThat(ranked).extracting(recommendation -> recommendation.candidate().name())
            .containsExactly("Thraben Inspector", "Savannah Lions");
    }

    @Test
    void should_NeverRecommendSource_When_SourceIsAmongCandidates() {
        CatalogSnapshot snapshot = snapshotOf(
            printing("p-1", "Shock").oracleId("o-shock").typeLine("Instant").colors(ManaColor.R)
                .text("Shock deals 2 damage to any target.").build(),
            printing("p-2", "Shock").oracleId("o-shock").typeLine("Instant").colors(ManaColor.R)
                .text("Shock deals 2 damage to any target.").set("m19").build(),
            printing("p-3", "Lightning Bolt").oracleId("o-bolt").typeLine("Instant").colors(ManaColor.R)
                .text("Lightning Bolt deals 3 damage to any target.").build());
        CardIdentity source = snapshot.getByKey(snapshot.keyForOracleId("o-shock").orElseThrow()).orElseThrow();

        List<Recommendation> ranked = engine.rank(source, snapshot.listIdentities(),
            RecommendationStrategy.FUNCTIONAL_SIMILARITY);

        assertThat(ranked).extracting(recommendation -> recommendation.candidate().key())
            .doesNotContain(source.key())
            .hasSize(1);
    }

    @Test
    void should_BreakTiesByName_When_ScoresEqual() {
        CatalogSnapshot snapshot = snapshotOf(
            printing("p-src", "Grizzly Bears").oracleId("o-src").typeLine("Creature — Bear").colors(ManaColor.G).build(),
            printing("p-b", "Bear B").oracleId("o-b").typeLine("Creature — Bear").colors(ManaColor.G).build(),
            printing("p-a", "Bear A").oracleId("o-a").typeLine("Creature — Bear").colors(ManaColor.G).build());
        CardIdentity source = snapshot.getByKey(snapshot.keyForOracleId("o-src").orElseThrow()).orElseThrow();

        List<Recommendation> first = engine.rank(source, snapshot.listIdentities(), RecommendationStrategy.FUNCTIONAL_SIMILARITY);
        List<Recommendation> second = engine.rank(source, snapshot.listIdentities(), RecommendationStrategy.FUNCTIONAL_SIMILARITY);

        assertThat(first).extracting(recommendation -> recommendation.candidate().name())
            .containsExactly("Bear A", "Bear B");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void should_FailFast_When_StrategyHasNoScorer() {
        assertThatThrownBy(() -> new RecommendationEngine(List.of(new SynergyScorer(weights))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("FUNCTIONAL_SIMILARITY");
    }
}
