package net.findmycard.service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.service.event.CatalogRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Counts recommendation requests per source identity so the warmup scheduler can
 * precompute rankings for the most requested cards.
 */
@Component
public class PopularCardTracker {

    private final Map<CardIdentityKey, LongAdder> requestCounts = new ConcurrentHashMap<>();

    public void record(CardIdentityKey key) {
        requestCounts.computeIfAbsent(key, ignored -> new LongAdder()).increment();
    }

    /**
     * Most requested keys, highest count first, ties by key.
     */
    public List<CardIdentityKey> topKeys(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return requestCounts.entrySet().stream()
            .sorted(Comparator.<Map.Entry<CardIdentityKey, LongAdder>>comparingLong(entry -> entry.getValue().sum())
                .reversed()
                .thenComparing(Map.Entry::getKey))
            .limit(limit)
            .map(Map.Entry::getKey)
            .toList();
    }

    public long countFor(CardIdentityKey key) {
        LongAdder adder = requestCounts.get(key);
        return adder == null ? 0L : adder.sum();
    }

    /**
     * A full re-import may retire keys entirely, so counts start over.
     */
    @EventListener
    public void onCatalogRefreshed(CatalogRefreshedEvent event) {
        if (event.isFullReplace()) {
            requestCounts.clear();
        }
    }
}
