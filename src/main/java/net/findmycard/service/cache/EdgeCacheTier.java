package net.findmycard.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import net.findmycard.exception.CacheTierException;

/**
 * Warm tier backed by an {@link EdgeKeyValueStore}. Values travel as a JSON envelope
 * holding the insertion time, lifetime and tags next to the value, so a hit can
 * back-fill the hot tier with the entry's remaining lifetime.
 */
public class EdgeCacheTier implements CacheTier {

    static final String NAME = "edge";

    private final EdgeKeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final Clock clock;

    public EdgeCacheTier(EdgeKeyValueStore store, ObjectMapper objectMapper, Duration timeout, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public <T> Optional<CacheEntry<T>> get(String key, JavaType type) {
        String payload = store.get(key).block(timeout);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            JsonNode envelope = objectMapper.readTree(payload);
            Instant insertedAt = Instant.ofEpochMilli(envelope.path("insertedAt").asLong());
            Duration ttl = Duration.ofSeconds(envelope.path("ttlSeconds").asLong());
            Set<String> tags = new LinkedHashSet<>();
            envelope.path("tags").forEach(tag -> tags.add(tag.asText()));
            T value = objectMapper.readerFor(type).readValue(envelope.get("value"));
            CacheEntry<T> entry = new CacheEntry<>(key, value, insertedAt, ttl, tags);
            return entry.isExpired(clock.instant()) ? Optional.empty() : Optional.of(entry);
        } catch (IOException | IllegalArgumentException ex) {
            throw new CacheTierException(NAME, "unreadable entry for " + key, ex);
        }
    }

    @Override
    public void put(CacheEntry<?> entry) {
        Duration remaining = entry.remainingTtl(clock.instant());
        if (remaining.isNegative() || remaining.isZero()) {
            return;
        }
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("insertedAt", entry.insertedAt().toEpochMilli());
        envelope.put("ttlSeconds", entry.ttl().toSeconds());
        entry.tags().forEach(envelope.putArray("tags")::add);
        envelope.set("value", objectMapper.valueToTree(entry.value()));
        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new CacheTierException(NAME, "could not serialize " + entry.key(), ex);
        }
        store.put(entry.key(), payload, remaining, entry.tags()).block(timeout);
    }

    @Override
    public void invalidateKey(String key) {
        store.delete(key).block(timeout);
    }

    @Override
    public void invalidateTags(Collection<String> tags) {
        if (supportsTagPurge()) {
            store.purgeTags(tags).block(timeout);
        }
    }

    @Override
    public boolean supportsTagPurge() {
        return store.supportsTagPurge();
    }
}
