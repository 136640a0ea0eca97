package net.findmycard.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalListener;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Factory for Caffeine caches so every in-process cache is built with stats and the same conventions.
 */
@Component
public class CacheFactory {

    /**
     * Create a cache bounded by entry count with a fixed time-to-live.
     */
    public <K, V> Cache<K, V> createCache(String name, long maxSize, Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache bounded by entry count whose entries each carry their own lifetime.
     */
    public <K, V> Cache<K, V> createCacheWithExpiry(String name,
                                                    long maxSize,
                                                    Expiry<K, V> expiry,
                                                    RemovalListener<K, V> removalListener) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats();
        Caffeine<K, V> typed = builder.expireAfter(expiry);
        if (removalListener != null) {
            typed = typed.removalListener(removalListener);
        }
        return typed.build();
    }

    /**
     * Create a byte-array cache bounded by total payload size.
     */
    public <K> Cache<K, byte[]> createByteWeightedCache(String name, long maxBytes) {
        return Caffeine.newBuilder()
            .maximumWeight(maxBytes)
            .<K, byte[]>weigher((key, bytes) -> bytes.length)
            .recordStats()
            .build();
    }
}
