package net.findmycard.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Utility class for common reactive controller patterns.
 */
@Slf4j
public final class ReactiveControllerUtils {

    private ReactiveControllerUtils() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * 200 OK with the emitted value; errors propagate to the exception handlers.
     */
    public static <T> Mono<ResponseEntity<T>> ok(Mono<T> data, String context) {
        return data.map(ResponseEntity::ok)
            .doOnError(ex -> log.debug("{} failed: {}", context, ex.toString()));
    }
}
