package net.findmycard.service.cache;

import java.util.LinkedHashSet;
import java.util.Set;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.service.filter.CardFilters;
import net.findmycard.service.scoring.RecommendationStrategy;
import net.findmycard.util.HashUtils;

/**
 * Cache key and tag conventions shared by writers and invalidation.
 */
public final class CacheKeys {

    public static final String SEARCH_TAG = "card-search";
    public static final String RECOMMENDATIONS_TAG = "card-recommendations";
    /** Carried by every entry so a full re-import can purge everything at once. */
    public static final String CATALOG_TAG = "card-catalog";

    private static final int FILTER_HASH_LENGTH = 24;

    private CacheKeys() {
    }

    public static String cardTag(CardIdentityKey key) {
        return key.cacheTag();
    }

    public static String card(CardIdentityKey key) {
        return "card:" + key;
    }

    public static Set<String> cardTags(CardIdentityKey key) {
        return Set.of(cardTag(key), CATALOG_TAG);
    }

    /**
     * Ranked, unfiltered candidates for one source and strategy; filters and limit are applied after the cache.
     */
    public static String recommendations(CardIdentityKey source, RecommendationStrategy strategy) {
        return "recs:" + strategy.wireValue() + ":" + source;
    }

    public static Set<String> recommendationTags(CardIdentityKey source) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(cardTag(source));
        tags.add(RECOMMENDATIONS_TAG);
        tags.add(CATALOG_TAG);
        return tags;
    }

    public static String search(String normalizedQuery, CardFilters filters, int page, int pageSize) {
        String fingerprint = (normalizedQuery == null ? "" : normalizedQuery)
            + "|" + filters.canonicalForm() + "|" + page + "|" + pageSize;
        return "search:" + HashUtils.sha256HexPrefix(fingerprint, FILTER_HASH_LENGTH);
    }

    public static Set<String> searchTags() {
        return Set.of(SEARCH_TAG, CATALOG_TAG);
    }
}
