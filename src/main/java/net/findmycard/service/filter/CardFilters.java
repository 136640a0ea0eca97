package net.findmycard.service.filter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;

/**
 * Validated facet set. Facets combine with AND; values within a facet combine with OR.
 * Empty collections and null bounds mean the facet is absent.
 *
 * @param colors candidate colors or color identity must include one of these; {@code C} selects colorless cards
 * @param colorIdentity candidate color identity must be a subset of these
 * @param types lower-cased type-line substrings
 * @param rarities at least one printing must have one of these rarities
 * @param format lower-cased format name the candidate must be legal or restricted in
 * @param minMv inclusive lower mana value bound
 * @param maxMv inclusive upper mana value bound
 * @param minPrice inclusive lower bound on the lowest USD price
 * @param maxPrice inclusive upper bound on the lowest USD price
 * @param oracleText lower-cased rules-text substring
 * @param sets lower-cased set codes; at least one printing must be from one of them
 * @param power exact printed power, compared case-insensitively ({@code *} and {@code X} included)
 * @param toughness exact printed toughness, compared case-insensitively
 * @param keywords lower-cased keyword abilities; the candidate must have one of them
 * @param includeMulticolored {@code false} narrows {@code colors} to cards whose colors equal the
 *                            selection exactly; null or {@code true} keeps the intersecting match
 */
public record CardFilters(Set<ManaColor> colors,
                          Set<ManaColor> colorIdentity,
                          List<String> types,
                          Set<Rarity> rarities,
                          String format,
                          Double minMv,
                          Double maxMv,
                          BigDecimal minPrice,
                          BigDecimal maxPrice,
                          String oracleText,
                          Set<String> sets,
                          String power,
                          String toughness,
                          Set<String> keywords,
                          Boolean includeMulticolored) {

    public static final CardFilters NONE = new CardFilters(null, null, null, null, null, null, null, null, null, null, null,
        null, null, null, null);

    public CardFilters {
        colors = colors == null ? Set.of() : Set.copyOf(colors);
        colorIdentity = colorIdentity == null ? Set.of() : Set.copyOf(colorIdentity);
        types = types == null ? List.of() : List.copyOf(types);
        rarities = rarities == null ? Set.of() : Set.copyOf(rarities);
        sets = sets == null ? Set.of() : Set.copyOf(sets);
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    }

    public boolean isEmpty() {
        return colors.isEmpty() && colorIdentity.isEmpty() && types.isEmpty() && rarities.isEmpty()
            && format == null && minMv == null && maxMv == null && minPrice == null && maxPrice == null
            && oracleText == null && sets.isEmpty() && power == null && toughness == null
            && keywords.isEmpty();
    }

    /**
     * True when the color facet is present and asks for an exact color match.
     */
    public boolean exactColorsOnly() {
        return Boolean.FALSE.equals(includeMulticolored) && !colors.isEmpty();
    }

    /**
     * Order-independent text form, stable across JVMs, used in cache keys.
     */
    public String canonicalForm() {
        return "colors=" + sorted(colors)
            + ";identity=" + sorted(colorIdentity)
            + ";types=" + types.stream().sorted().collect(Collectors.joining(","))
            + ";rarities=" + sorted(rarities)
            + ";format=" + Objects.toString(format, "")
            + ";mv=" + Objects.toString(minMv, "") + ".." + Objects.toString(maxMv, "")
            + ";price=" + plain(minPrice) + ".." + plain(maxPrice)
            + ";text=" + Objects.toString(oracleText, "")
            + ";sets=" + sets.stream().sorted().collect(Collectors.joining(","))
            + ";pt=" + Objects.toString(power, "") + "/" + Objects.toString(toughness, "")
            + ";keywords=" + keywords.stream().sorted().collect(Collectors.joining(","))
            + ";multicolored=" + (exactColorsOnly() ? "exact" : "any");
    }

    private static String sorted(Set<? extends Enum<?>> values) {
        return values.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }

    private static String plain(BigDecimal value) {
        return value == null ? "" : value.stripTrailingZeros().toPlainString();
    }

    public boolean hasPriceBound() {
        return minPrice != null || maxPrice != null;
    }
}
