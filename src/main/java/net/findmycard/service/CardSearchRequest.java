package net.findmycard.service;

import net.findmycard.service.filter.CardFilters;
import net.findmycard.util.CardTextNormalizer;
import net.findmycard.util.PagingUtils;

/**
 * A validated catalog search: name query, facets and a one-based page.
 */
public record CardSearchRequest(String query, CardFilters filters, int page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 175;

    public CardSearchRequest {
        query = query == null ? "" : CardTextNormalizer.normalizeName(query);
        filters = filters == null ? CardFilters.NONE : filters;
        page = Math.max(1, page);
        pageSize = PagingUtils.clamp(pageSize <= 0 ? DEFAULT_PAGE_SIZE : pageSize, 1, MAX_PAGE_SIZE);
    }

    public static CardSearchRequest of(String query, CardFilters filters, Integer page, Integer pageSize) {
        return new CardSearchRequest(query,
            filters,
            page == null ? 1 : page,
            pageSize == null ? DEFAULT_PAGE_SIZE : pageSize);
    }
}
