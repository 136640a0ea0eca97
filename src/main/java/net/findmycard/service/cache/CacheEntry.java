package net.findmycard.service.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * A cached value with the metadata every tier keeps for it.
 *
 * @param key cache key
 * @param value cached value, never null
 * @param insertedAt when the value was first computed
 * @param ttl lifetime measured from {@code insertedAt}
 * @param tags invalidation tags
 */
public record CacheEntry<T>(String key, T value, Instant insertedAt, Duration ttl, Set<String> tags) {

    public CacheEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key must not be blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("cache value must not be null for key " + key);
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /** Lifetime left at {@code now}; zero or negative once expired. */
    public Duration remainingTtl(Instant now) {
        return ttl.minus(Duration.between(insertedAt, now));
    }

    public boolean isExpired(Instant now) {
        Duration remaining = remainingTtl(now);
        return remaining.isZero() || remaining.isNegative();
    }
}
