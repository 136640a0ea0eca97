package net.findmycard.service.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import net.findmycard.exception.InvalidFilterException;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardFilterParserTest {

    private final CardFilterParser parser = new CardFilterParser(new ObjectMapper());

    @Test
    void should_ReturnNone_When_FiltersParameterIsBlank() {
        assertThat(parser.parseJson(null)).isSameAs(CardFilters.NONE);
        assertThat(parser.parseJson("  ")).isSameAs(CardFilters.NONE);
        assertThat(parser.parseJson("{}").isEmpty()).isTrue();
    }

    @Test
    void should_ParseEveryFacet_When_JsonIsWellFormed() {
        CardFilters filters = parser.parseJson("""
            {"colors":["W","u"],"colorIdentity":"W,U","types":["Creature"],"rarities":["Rare"],
             "format":"Modern","minMv":"1","maxMv":3,"minPrice":"0.10","maxPrice":"5",
             "oracleText":"  Draw A Card ","sets":["M19"]}
            """);

        assertThat(filters.colors()).containsExactlyInAnyOrder(ManaColor.W, ManaColor.U);
        assertThat(filters.colorIdentity()).containsExactlyInAnyOrder(ManaColor.W, ManaColor.U);
        assertThat(filters.types()).containsExactly("creature");
        assertThat(filters.rarities()).containsExactly(Rarity.RARE);
        assertThat(filters.format()).isEqualTo("modern");
        assertThat(filters.minMv()).isEqualTo(1.0);
        assertThat(filters.maxMv()).isEqualTo(3.0);
        assertThat(filters.minPrice()).isEqualByComparingTo("0.10");
        assertThat(filters.maxPrice()).isEqualByComparingTo(BigDecimal.valueOf(5));
        assertThat(filters.oracleText()).isEqualTo("draw a card");
        assertThat(filters.sets()).containsExactly("m19");
    }

    @Test
    void should_TreatAllFormatAsNoFormat_When_FormatIsAll() {
        assertThat(parser.parseJson("{\"format\":\"all\"}").format()).isNull();
    }

    @Test
    void should_RejectUnknownFacet_When_NameIsNotRecognized() {
        assertThatThrownBy(() -> parser.parseJson("{\"flavor\":\"x\"}"))
            .isInstanceOf(InvalidFilterException.class)
            .hasMessageContaining("flavor")
            .extracting(ex -> ((InvalidFilterException) ex).getFacet())
            .isEqualTo("flavor");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{colors:", "[1,2]", "\"text\""})
    void should_RejectFilters_When_JsonIsMalformedOrNotAnObject(String json) {
        assertThatThrownBy(() -> parser.parseJson(json)).isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void should_RejectInvertedRange_When_MinExceedsMax() {
        assertThatThrownBy(() -> parser.parseJson("{\"minMv\":5,\"maxMv\":2}"))
            .isInstanceOf(InvalidFilterException.class)
            .hasMessageContaining("minMv must not exceed maxMv");
        assertThatThrownBy(() -> parser.parseJson("{\"minPrice\":\"10\",\"maxPrice\":\"1\"}"))
            .isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void should_RejectNegativeOrNonNumericBounds() {
        assertThatThrownBy(() -> parser.parseJson("{\"minMv\":-1}")).isInstanceOf(InvalidFilterException.class);
        assertThatThrownBy(() -> parser.parseJson("{\"maxPrice\":\"cheap\"}")).isInstanceOf(InvalidFilterException.class);
    }

    @Test
    void should_RejectUnknownValues_When_ColorRarityOrFormatIsInvalid() {
        assertThatThrownBy(() -> parser.parseJson("{\"colors\":[\"P\"]}"))
            .isInstanceOf(InvalidFilterException.class).hasMessageContaining("Unknown color");
        assertThatThrownBy(() -> parser.parseJson("{\"rarities\":[\"legendary\"]}"))
            .isInstanceOf(InvalidFilterException.class).hasMessageContaining("Unknown rarity");
        assertThatThrownBy(() -> parser.parseJson("{\"format\":\"frontier\"}"))
            .isInstanceOf(InvalidFilterException.class).hasMessageContaining("Unknown format");
    }

    @Test
    void should_SplitCommaSeparatedQueryValues_When_ValidatingFacetInput() {
        FacetInput input = new FacetInput(List.of("W,B"), null, List.of("Instant, Sorcery"), null,
            null, null, null, null, null, null, null, null, null, List.of("Flying,Lifelink"), null);

        CardFilters filters = parser.validate(input);

        assertThat(filters.colors()).containsExactlyInAnyOrder(ManaColor.W, ManaColor.B);
        assertThat(filters.types()).containsExactlyInAnyOrder("instant", "sorcery");
        assertThat(filters.keywords()).containsExactlyInAnyOrder("flying", "lifelink");
    }

    @Test
    void should_RejectUnreadableStatsAndFlags_When_Parsing() {
        assertThatThrownBy(() -> parser.parseJson("{\"power\":\"huge\"}"))
            .isInstanceOf(InvalidFilterException.class).hasMessageContaining("power");
        assertThatThrownBy(() -> parser.parseJson("{\"includeMulticolored\":\"maybe\"}"))
            .isInstanceOf(InvalidFilterException.class).hasMessageContaining("true or false");
    }

    @Test
    void should_DistinguishCacheForms_When_NewFacetsDiffer() {
        CardFilters exact = parser.parseJson("{\"colors\":[\"W\"],\"includeMulticolored\":false}");
        CardFilters any = parser.parseJson("{\"colors\":[\"W\"]}");
        CardFilters flyers = parser.parseJson("{\"keywords\":\"Flying\",\"power\":\"*\"}");

        assertThat(exact.canonicalForm()).isNotEqualTo(any.canonicalForm());
        assertThat(flyers.canonicalForm()).contains("keywords=flying").contains("pt=*/");
        assertThat(flyers.isEmpty()).isFalse();
    }
}
