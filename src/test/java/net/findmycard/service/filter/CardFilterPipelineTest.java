package net.findmycard.service.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.Legality;
import net.findmycard.model.ManaColor;
import net.findmycard.service.scoring.Recommendation;
import org.junit.jupiter.api.Test;

import static net.findmycard.testutil.CardTestData.printing;
import static org.assertj.core.api.Assertions.assertThat;

class CardFilterPipelineTest {

    private static final CardIdentity SAVANNAH_LIONS = printing("p-lions", "Savannah Lions").oracleId("o-lions")
        .typeLine("Creature — Cat").colors(ManaColor.W).manaCost("{W}", 1).usd("0.30")
        .stats("2", "1").legal("modern", Legality.LEGAL).identity();
    private static final CardIdentity COUNTERSPELL = printing("p-counter", "Counterspell").oracleId("o-counter")
        .typeLine("Instant").colors(ManaColor.U).manaCost("{U}{U}", 2).text("Counter target spell.")
        .usd("1.50").legal("modern", Legality.NOT_LEGAL).identity();
    private static final CardIdentity AZORIUS_CHARM = printing("p-charm", "Azorius Charm").oracleId("o-charm")
        .typeLine("Instant").colors(ManaColor.W, ManaColor.U).manaCost("{W}{U}", 2)
        .keywords("Cycling").text("Draw a card.").identity();
    private static final CardIdentity SOL_RING = printing("p-ring", "Sol Ring").oracleId("o-ring")
        .typeLine("Artifact").manaCost("{1}", 1).text("{T}: Add {C}{C}.").usd("2.00")
        .legal("modern", Legality.BANNED).identity();

    private final CardFilterPipeline pipeline = new CardFilterPipeline();
    private final CardFilterParser parser = new CardFilterParser(new ObjectMapper());

    private static List<Recommendation> ranked() {
        return List.of(
            new Recommendation(AZORIUS_CHARM, 0.9, "a"),
            new Recommendation(COUNTERSPELL, 0.8, "b"),
            new Recommendation(SAVANNAH_LIONS, 0.7, "c"),
            new Recommendation(SOL_RING, 0.6, "d"));
    }

    @Test
    void should_KeepOnlyWhiteCandidatesInOrder_When_ColorFilterIsWhite() {
        List<Recommendation> filtered = pipeline.apply(ranked(), parser.parseJson("{\"colors\":[\"W\"]}"));

        assertThat(filtered).extracting(r -> r.candidate().name())
            .containsExactly("Azorius Charm", "Savannah Lions");
        assertThat(filtered).extracting(Recommendation::score).containsExactly(0.9, 0.7);
    }

    @Test
    void should_ReturnInputUnchanged_When_FiltersAreEmpty() {
        List<Recommendation> ranked = ranked();

        assertThat(pipeline.apply(ranked, CardFilters.NONE)).isSameAs(ranked);
        assertThat(pipeline.apply(ranked, null)).isSameAs(ranked);
    }

    @Test
    void should_NeverGrowResult_When_FacetsAreAdded() {
        List<Recommendation> instants = pipeline.apply(ranked(), parser.parseJson("{\"types\":[\"instant\"]}"));
        List<Recommendation> blueInstants = pipeline.apply(ranked(),
            parser.parseJson("{\"types\":[\"instant\"],\"colors\":[\"U\"],\"maxMv\":1}"));

        assertThat(instants).hasSize(2);
        assertThat(instants).containsAll(blueInstants);
        assertThat(blueInstants).isEmpty();
    }

    @Test
    void should_SelectColorlessCards_When_ColorsIncludeColorless() {
        List<Recommendation> filtered = pipeline.apply(ranked(), parser.parseJson("{\"colors\":[\"C\"]}"));

        assertThat(filtered).extracting(r -> r.candidate().name()).containsExactly("Sol Ring");
    }

    @Test
    void should_RequireSubsetOfIdentity_When_ColorIdentityFacetIsSet() {
        List<Recommendation> filtered = pipeline.apply(ranked(), parser.parseJson("{\"colorIdentity\":[\"U\"]}"));

        assertThat(filtered).extracting(r -> r.candidate().name()).containsExactly("Counterspell", "Sol Ring");
    }

    @Test
    void should_ExcludeUnpricedCards_When_PriceBoundIsSet() {
        List<Recommendation> filtered = pipeline.apply(ranked(), parser.parseJson("{\"maxPrice\":\"1.50\"}"));

        assertThat(filtered).extracting(r -> r.candidate().name()).containsExactly("Counterspell", "Savannah Lions");
    }

    @Test
    void should_MatchOnlyPlayableLegality_When_FormatIsSet() {
        List<Recommendation> filtered = pipeline.apply(ranked(), parser.parseJson("{\"format\":\"modern\"}"));

        assertThat(filtered).extracting(r -> r.candidate().name()).containsExactly("Savannah Lions");
    }

    @Test
    void should_MatchRulesTextAndManaValue_When_FilteringIdentities() {
        List<CardIdentity> identities = List.of(SAVANNAH_LIONS, COUNTERSPELL, AZORIUS_CHARM, SOL_RING);

        assertThat(pipeline.applyToIdentities(identities, parser.parseJson("{\"oracleText\":\"COUNTER target\"}")))
            .containsExactly(COUNTERSPELL);
        assertThat(pipeline.applyToIdentities(identities, parser.parseJson("{\"minMv\":2,\"maxMv\":2}")))
            .containsExactly(COUNTERSPELL, AZORIUS_CHARM);
    }

    @Test
    void should_MatchPrintedPowerAndToughnessExactly_When_StatFacetsAreGiven() {
        List<Recommendation> twoOne = pipeline.apply(ranked(), parser.parseJson("{\"power\":\"2\",\"toughness\":1}"));
        List<Recommendation> twoTwo = pipeline.apply(ranked(), parser.parseJson("{\"power\":\"2\",\"toughness\":\"2\"}"));

        assertThat(twoOne).extracting(r -> r.candidate().name()).containsExactly("Savannah Lions");
        assertThat(twoTwo).isEmpty();
    }

    @Test
    void should_MatchAnyListedKeyword_When_KeywordFacetIsGiven() {
        List<Recommendation> filtered = pipeline.apply(ranked(), parser.parseJson("{\"keywords\":[\"flying\",\"CYCLING\"]}"));

        assertThat(filtered).extracting(r -> r.candidate().name()).containsExactly("Azorius Charm");
    }

    @Test
    void should_ExcludeMulticoloredCards_When_IncludeMulticoloredIsFalse() {
        List<Recommendation> exact = pipeline.apply(ranked(),
            parser.parseJson("{\"colors\":[\"W\"],\"includeMulticolored\":false}"));
        List<Recommendation> any = pipeline.apply(ranked(),
            parser.parseJson("{\"colors\":[\"W\"],\"includeMulticolored\":true}"));
        List<Recommendation> exactPair = pipeline.apply(ranked(),
            parser.parseJson("{\"colors\":[\"W\",\"U\"],\"includeMulticolored\":\"false\"}"));

        assertThat(exact).extracting(r -> r.candidate().name()).containsExactly("Savannah Lions");
        assertThat(any).extracting(r -> r.candidate().name()).containsExactly("Azorius Charm", "Savannah Lions");
        assertThat(exactPair).extracting(r -> r.candidate().name()).containsExactly("Azorius Charm");
    }
}
