package net.findmycard.service.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.findmycard.exception.InvalidFilterException;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;
import net.findmycard.util.ValidationUtils;
import org.springframework.stereotype.Component;

/**
 * Turns raw facet input into validated {@link CardFilters}.
 *
 * <p>Validation fails fast with {@link InvalidFilterException}: unknown facet names or
 * values, negative bounds, inverted ranges and malformed JSON are all rejected, so a
 * request never runs with a partially applied filter.</p>
 */
@Component
public class CardFilterParser {

    /** Formats the card-data feed reports legalities for. {@code all} disables the facet. */
    static final Set<String> KNOWN_FORMATS = Set.of(
        "standard", "future", "historic", "timeless", "gladiator", "pioneer", "explorer",
        "modern", "legacy", "pauper", "vintage", "penny", "commander", "oathbreaker",
        "standardbrawl", "brawl", "alchemy", "paupercommander", "duel", "oldschool",
        "premodern", "predh");

    private static final String ALL_FORMATS = "all";

    /** Printed power/toughness: digits, {@code *}, {@code X}, {@code ?}, {@code ∞}, halves and +/- modifiers. */
    private static final Pattern STAT = Pattern.compile("[0-9xX*?+\\-.½∞]{1,6}");

    private final ObjectMapper objectMapper;

    public CardFilterParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the {@code filters} request parameter, a JSON object of facets.
     * A null or blank value yields {@link CardFilters#NONE}.
     */
    public CardFilters parseJson(String json) {
        if (!ValidationUtils.hasText(json)) {
            return CardFilters.NONE;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new InvalidFilterException("filters", "filters must be a JSON object", ex);
        }
        if (root == null || root.isNull()) {
            return CardFilters.NONE;
        }
        if (!root.isObject()) {
            throw new InvalidFilterException("filters", "filters must be a JSON object");
        }

        List<String> colors = null;
        List<String> colorIdentity = null;
        List<String> types = null;
        List<String> rarities = null;
        List<String> sets = null;
        String format = null;
        String minMv = null;
        String maxMv = null;
        String minPrice = null;
        String maxPrice = null;
        String oracleText = null;
        String power = null;
        String toughness = null;
        List<String> keywords = null;
        String includeMulticolored = null;

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            switch (field.getKey()) {
                case "colors" -> colors = textList(field.getKey(), value);
                case "colorIdentity" -> colorIdentity = textList(field.getKey(), value);
                case "types" -> types = textList(field.getKey(), value);
                case "rarities" -> rarities = textList(field.getKey(), value);
                case "sets" -> sets = textList(field.getKey(), value);
                case "format" -> format = scalar(field.getKey(), value);
                case "minMv" -> minMv = scalar(field.getKey(), value);
                case "maxMv" -> maxMv = scalar(field.getKey(), value);
                case "minPrice" -> minPrice = scalar(field.getKey(), value);
                case "maxPrice" -> maxPrice = scalar(field.getKey(), value);
                case "oracleText" -> oracleText = scalar(field.getKey(), value);
                case "power" -> power = scalar(field.getKey(), value);
                case "toughness" -> toughness = scalar(field.getKey(), value);
                case "keywords" -> keywords = textList(field.getKey(), value);
                case "includeMulticolored" -> includeMulticolored = scalar(field.getKey(), value);
                default -> throw new InvalidFilterException(field.getKey(), "Unknown filter facet '" + field.getKey() + "'");
            }
        }
        return validate(new FacetInput(colors, colorIdentity, types, rarities, format,
            minMv, maxMv, minPrice, maxPrice, oracleText, sets, power, toughness, keywords, includeMulticolored));
    }

    public CardFilters validate(FacetInput input) {
        if (input == null) {
            return CardFilters.NONE;
        }
        Double minMv = nonNegativeDouble("minMv", input.minMv());
        Double maxMv = nonNegativeDouble("maxMv", input.maxMv());
        if (minMv != null && maxMv != null && minMv > maxMv) {
            throw new InvalidFilterException("minMv", "minMv must not exceed maxMv");
        }
        BigDecimal minPrice = nonNegativeDecimal("minPrice", input.minPrice());
        BigDecimal maxPrice = nonNegativeDecimal("maxPrice", input.maxPrice());
        if (minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0) {
            throw new InvalidFilterException("minPrice", "minPrice must not exceed maxPrice");
        }
        String oracleText = ValidationUtils.trimToNull(input.oracleText());
        return new CardFilters(
            colors("colors", input.colors()),
            colors("colorIdentity", input.colorIdentity()),
            lowerCased(input.types()),
            rarities(input.rarities()),
            format(input.format()),
            minMv,
            maxMv,
            minPrice,
            maxPrice,
            oracleText == null ? null : oracleText.toLowerCase(Locale.ROOT),
            new LinkedHashSet<>(lowerCased(input.sets())),
            stat("power", input.power()),
            stat("toughness", input.toughness()),
            new LinkedHashSet<>(lowerCased(input.keywords())),
            bool("includeMulticolored", input.includeMulticolored()));
    }

    private static String stat(String facet, String raw) {
        String value = ValidationUtils.trimToNull(raw);
        if (value == null) {
            return null;
        }
        if (!STAT.matcher(value).matches()) {
            throw new InvalidFilterException(facet, "Unknown " + facet + " '" + value + "'");
        }
        return value.toLowerCase(Locale.ROOT);
    }

    private static Boolean bool(String facet, String raw) {
        String value = ValidationUtils.trimToNull(raw);
        if (value == null) {
            return null;
        }
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw new InvalidFilterException(facet, facet + " must be true or false");
    }

    private static Set<ManaColor> colors(String facet, List<String> raw) {
        Set<ManaColor> colors = EnumSet.noneOf(ManaColor.class);
        for (String value : split(raw)) {
            colors.add(ManaColor.fromSymbol(value)
                .orElseThrow(() -> new InvalidFilterException(facet,
                    "Unknown color '" + value + "' in " + facet + "; expected one of W, U, B, R, G, C")));
        }
        return colors;
    }

    private static Set<Rarity> rarities(List<String> raw) {
        Set<Rarity> rarities = EnumSet.noneOf(Rarity.class);
        for (String value : split(raw)) {
            rarities.add(Rarity.fromWireValue(value)
                .orElseThrow(() -> new InvalidFilterException("rarities",
                    "Unknown rarity '" + value + "'; expected common, uncommon, rare, mythic, special or bonus")));
        }
        return rarities;
    }

    private static String format(String raw) {
        String format = ValidationUtils.trimToNull(raw);
        if (format == null) {
            return null;
        }
        String normalized = format.toLowerCase(Locale.ROOT);
        if (ALL_FORMATS.equals(normalized)) {
            return null;
        }
        if (!KNOWN_FORMATS.contains(normalized)) {
            throw new InvalidFilterException("format", "Unknown format '" + format + "'");
        }
        return normalized;
    }

    private static Double nonNegativeDouble(String facet, String raw) {
        String value = ValidationUtils.trimToNull(raw);
        if (value == null) {
            return null;
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new InvalidFilterException(facet, facet + " must be a number", ex);
        }
        if (!Double.isFinite(parsed) || parsed < 0) {
            throw new InvalidFilterException(facet, facet + " must be a non-negative number");
        }
        return parsed;
    }

    private static BigDecimal nonNegativeDecimal(String facet, String raw) {
        String value = ValidationUtils.trimToNull(raw);
        if (value == null) {
            return null;
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value);
        } catch (NumberFormatException ex) {
            throw new InvalidFilterException(facet, facet + " must be a number", ex);
        }
        if (parsed.signum() < 0) {
            throw new InvalidFilterException(facet, facet + " must be a non-negative number");
        }
        return parsed;
    }

    private static List<String> lowerCased(List<String> raw) {
        return split(raw).stream().map(value -> value.toLowerCase(Locale.ROOT)).toList();
    }

    /** Flattens comma-separated entries and drops blanks. */
    private static List<String> split(List<String> raw) {
        if (ValidationUtils.isNullOrEmpty(raw)) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (String entry : raw) {
            if (entry == null) {
                continue;
            }
            for (String part : entry.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    values.add(trimmed);
                }
            }
        }
        return values;
    }

    private static List<String> textList(String facet, JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return List.of(value.asText());
        }
        if (!value.isArray()) {
            throw new InvalidFilterException(facet, facet + " must be an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw new InvalidFilterException(facet, facet + " must be an array of strings");
            }
            values.add(element.asText());
        }
        return values;
    }

    private static String scalar(String facet, JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new InvalidFilterException(facet, facet + " must be a single value");
        }
        return value.asText();
    }
}
