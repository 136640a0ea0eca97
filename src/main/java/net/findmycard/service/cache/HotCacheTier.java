package net.findmycard.service.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import net.findmycard.config.CacheFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process Caffeine tier. Entries expire individually after their own remaining
 * lifetime; a tag index maps each tag to the keys carrying it.
 */
public class HotCacheTier implements CacheTier {

    private static final Logger log = LoggerFactory.getLogger(HotCacheTier.class);
    static final String NAME = "hot";

    private final Cache<String, CacheEntry<?>> entries;
    private final ConcurrentHashMap<String, Set<String>> keysByTag = new ConcurrentHashMap<>();
    private final Clock clock;

    public HotCacheTier(CacheFactory cacheFactory, long maxSize, Clock clock) {
        this.clock = clock;
        this.entries = cacheFactory.createCacheWithExpiry("hot-responses", maxSize,
            new EntryExpiry(clock), (key, entry, cause) -> onRemoval(key, entry, cause));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<CacheEntry<T>> get(String key, JavaType type) {
        CacheEntry<?> entry = entries.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.invalidate(key);
            return Optional.empty();
        }
        if (!type.getRawClass().isInstance(entry.value())) {
            log.debug("Hot cache entry {} holds {} rather than {}; treating as miss",
                key, entry.value().getClass().getSimpleName(), type.getRawClass().getSimpleName());
            return Optional.empty();
        }
        return Optional.of((CacheEntry<T>) entry);
    }

    @Override
    public void put(CacheEntry<?> entry) {
        if (entry.isExpired(clock.instant())) {
            return;
        }
        for (String tag : entry.tags()) {
            keysByTag.computeIfAbsent(tag, t -> ConcurrentHashMap.newKeySet()).add(entry.key());
        }
        entries.put(entry.key(), entry);
        // a purge between indexing and insertion took the key out of the index before the entry existed
        for (String tag : entry.tags()) {
            Set<String> keys = keysByTag.get(tag);
            if (keys == null || !keys.contains(entry.key())) {
                entries.invalidate(entry.key());
                return;
            }
        }
    }

    @Override
    public void invalidateKey(String key) {
        entries.invalidate(key);
    }

    @Override
    public void invalidateTags(Collection<String> tags) {
        for (String tag : tags) {
            Set<String> keys = keysByTag.remove(tag);
            if (keys != null && !keys.isEmpty()) {
                entries.invalidateAll(keys);
                log.debug("Hot cache purged {} entries tagged {}", keys.size(), tag);
            }
        }
    }

    @Override
    public boolean supportsTagPurge() {
        return true;
    }

    long estimatedSize() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private void onRemoval(String key, CacheEntry<?> entry, RemovalCause cause) {
        if (key == null || entry == null || cause == RemovalCause.REPLACED) {
            return;
        }
        // removal notifications are asynchronous; a newer entry under the same key keeps its index
        if (entries.asMap().containsKey(key)) {
            return;
        }
        for (String tag : entry.tags()) {
            keysByTag.computeIfPresent(tag, (t, keys) -> {
                keys.remove(key);
                return keys.isEmpty() ? null : keys;
            });
        }
    }

    /**
     * Expires each entry when its own remaining lifetime runs out.
     */
    private static final class EntryExpiry implements Expiry<String, CacheEntry<?>> {

        private final Clock clock;

        private EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry<?> entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry<?> entry) {
            Duration remaining = entry.remainingTtl(clock.instant());
            return remaining.isNegative() ? 0L : remaining.toNanos();
        }
    }
}
