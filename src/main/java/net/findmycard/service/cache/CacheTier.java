package net.findmycard.service.cache;

import com.fasterxml.jackson.databind.JavaType;
import java.util.Collection;
import java.util.Optional;

/**
 * One level of the response cache. Tiers may throw on any operation; the
 * {@link CacheCoordinator} treats a failing tier as a miss.
 */
public interface CacheTier {

    String name();

    <T> Optional<CacheEntry<T>> get(String key, JavaType type);

    void put(CacheEntry<?> entry);

    void invalidateKey(String key);

    /**
     * Drops every entry carrying one of {@code tags}. Tiers without tag support
     * ignore the call and rely on TTL expiry.
     */
    void invalidateTags(Collection<String> tags);

    boolean supportsTagPurge();
}
