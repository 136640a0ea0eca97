package net.findmycard.service.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import reactor.core.publisher.Mono;

/**
 * Remote key-value store shared by every application instance.
 */
public interface EdgeKeyValueStore {

    /** Stored value, or an empty Mono on a miss. */
    Mono<String> get(String key);

    Mono<Void> put(String key, String value, Duration ttl, Set<String> tags);

    Mono<Void> delete(String key);

    Mono<Void> purgeTags(Collection<String> tags);

    boolean supportsTagPurge();
}
