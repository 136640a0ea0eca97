package net.findmycard.service.filter;

import java.util.List;

/**
 * Unvalidated facet values as they arrive from query parameters or a filters JSON object.
 * List facets accept comma-separated entries; numeric facets are kept as text until validated.
 */
public record FacetInput(List<String> colors,
                         List<String> colorIdentity,
                         List<String> types,
                         List<String> rarities,
                         String format,
                         String minMv,
                         String maxMv,
                         String minPrice,
                         String maxPrice,
                         String oracleText,
                         List<String> sets,
                         String power,
                         String toughness,
                         List<String> keywords,
                         String includeMulticolored) {

    public static final FacetInput EMPTY = new FacetInput(null, null, null, null, null, null, null, null, null, null, null,
        null, null, null, null);
}
