package net.findmycard.service.cache;

import com.fasterxml.jackson.databind.JavaType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import net.findmycard.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through chain over ordered {@link CacheTier}s, fastest first.
 *
 * <p>A hit at one tier back-fills every faster tier with the entry's remaining lifetime.
 * A miss on every tier computes the value and stores it in all of them before it is
 * returned. Any tier failure is logged and handled as a miss, so callers never see a
 * cache error and always get the value the loader would produce.</p>
 */
public class CacheCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CacheCoordinator.class);

    private final List<CacheTier> tiers;
    private final Clock clock;

    public CacheCoordinator(List<CacheTier> tiers, Clock clock) {
        this.tiers = List.copyOf(tiers);
        this.clock = clock;
    }

    public List<String> tierNames() {
        return tiers.stream().map(CacheTier::name).toList();
    }

    public <T> Optional<T> get(String key, JavaType type) {
        for (int index = 0; index < tiers.size(); index++) {
            CacheTier tier = tiers.get(index);
            Optional<CacheEntry<T>> hit = read(tier, key, type);
            if (hit.isPresent()) {
                backFill(hit.get(), index);
                return Optional.of(hit.get().value());
            }
        }
        return Optional.empty();
    }

    public void put(String key, Object value, Duration ttl, Set<String> tags) {
        CacheEntry<Object> entry = new CacheEntry<>(key, value, clock.instant(), ttl, tags);
        for (CacheTier tier : tiers) {
            write(tier, entry);
        }
    }

    /**
     * Returns the cached value for {@code key}, or computes, stores and returns it.
     * Loader exceptions propagate unchanged and nothing is cached for them.
     */
    public <T> T getOrCompute(String key, JavaType type, Duration ttl, Set<String> tags, Supplier<T> loader) {
        return getOrCompute(key, type, ttl, tags, loader, () -> true);
    }

    /**
     * Like {@link #getOrCompute(String, JavaType, Duration, Set, Supplier)}, but the computed
     * value is only kept while {@code stillCurrent} holds. A value whose source changed during
     * the computation is returned to the caller without being stored, and a value stored
     * just before such a change is dropped again, so a purge racing the computation cannot
     * be undone by it.
     */
    public <T> T getOrCompute(String key, JavaType type, Duration ttl, Set<String> tags,
                              Supplier<T> loader, BooleanSupplier stillCurrent) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T computed = loader.get();
        if (computed == null) {
            return null;
        }
        if (!stillCurrent.getAsBoolean()) {
            log.debug("Source of {} changed while computing; not caching", key);
            return computed;
        }
        put(key, computed, ttl, tags);
        if (!stillCurrent.getAsBoolean()) {
            log.debug("Source of {} changed while storing; dropping the stored entry", key);
            invalidateKey(key);
        }
        return computed;
    }

    /**
     * Drops {@code tagOrKey} both as a key and as a tag on every tier.
     */
    public void invalidate(String tagOrKey) {
        invalidateKey(tagOrKey);
        invalidateTags(Set.of(tagOrKey));
    }

    public void invalidateKey(String key) {
        for (CacheTier tier : tiers) {
            try {
                tier.invalidateKey(key);
            } catch (RuntimeException ex) {
                LoggingUtils.warn(log, ex, "Cache tier {} failed to invalidate key {}", tier.name(), key);
            }
        }
    }

    public void invalidateTags(Collection<String> tags) {
        if (tags.isEmpty()) {
            return;
        }
        for (CacheTier tier : tiers) {
            if (!tier.supportsTagPurge()) {
                log.debug("Cache tier {} has no tag purge; {} tags left to expire by TTL", tier.name(), tags.size());
                continue;
            }
            try {
                tier.invalidateTags(tags);
            } catch (RuntimeException ex) {
                LoggingUtils.warn(log, ex, "Cache tier {} failed to purge {} tags", tier.name(), tags.size());
            }
        }
    }

    private <T> Optional<CacheEntry<T>> read(CacheTier tier, String key, JavaType type) {
        try {
            return tier.get(key, type);
        } catch (RuntimeException ex) {
            log.warn("Cache tier {} unavailable for {}; treating as miss ({})",
                tier.name(), key, LoggingUtils.describe(ex));
            return Optional.empty();
        }
    }

    private void write(CacheTier tier, CacheEntry<?> entry) {
        try {
            tier.put(entry);
        } catch (RuntimeException ex) {
            log.warn("Cache tier {} could not store {} ({})", tier.name(), entry.key(), LoggingUtils.describe(ex));
        }
    }

    private void backFill(CacheEntry<?> entry, int hitIndex) {
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            return;
        }
        for (int index = 0; index < hitIndex; index++) {
            write(tiers.get(index), entry);
        }
    }
}
