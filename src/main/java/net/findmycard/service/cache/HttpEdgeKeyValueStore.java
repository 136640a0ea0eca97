package net.findmycard.service.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.findmycard.config.CacheTierProperties;
import net.findmycard.exception.CacheTierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Edge key-value store spoken to over HTTP in the Cloudflare Workers KV style:
 * {@code GET|PUT|DELETE {base}/values/{key}} for entries and
 * {@code POST {purge} {"tags": [...]}} for tag purges.
 *
 * <p>Every call runs behind the {@code edgeKeyValueStore} circuit breaker; when it is open
 * or a call fails, the fallback surfaces a {@link CacheTierException} that the cache
 * coordinator turns into a miss.</p>
 */
public class HttpEdgeKeyValueStore implements EdgeKeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(HttpEdgeKeyValueStore.class);

    static final String CACHE_TAG_HEADER = "Cache-Tag";
    /** Smallest expiration the store accepts. */
    static final Duration MINIMUM_TTL = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final String purgeUrl;
    private final int purgeBatchSize;

    public HttpEdgeKeyValueStore(WebClient.Builder webClientBuilder, CacheTierProperties properties) {
        CacheTierProperties.Edge edge = properties.getEdge();
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(edge.getBaseUrl());
        if (StringUtils.hasText(edge.getApiToken())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + edge.getApiToken());
        }
        this.webClient = builder.build();
        this.purgeUrl = edge.getPurgeUrl();
        this.purgeBatchSize = edge.getPurgeBatchSize();
    }

    @Override
    @CircuitBreaker(name = "edgeKeyValueStore", fallbackMethod = "getFallback")
    public Mono<String> get(String key) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path("/values/{key}").build(key))
            .retrieve()
            .bodyToMono(String.class)
            .onErrorResume(WebClientResponseException.NotFound.class, ex -> Mono.empty());
    }

    @Override
    @CircuitBreaker(name = "edgeKeyValueStore", fallbackMethod = "writeFallback")
    public Mono<Void> put(String key, String value, Duration ttl, Set<String> tags) {
        long ttlSeconds = Math.max(MINIMUM_TTL.toSeconds(), ttl.toSeconds());
        return webClient.put()
            .uri(uriBuilder -> uriBuilder.path("/values/{key}")
                .queryParam("expiration_ttl", ttlSeconds)
                .build(key))
            .contentType(MediaType.APPLICATION_JSON)
            .header(CACHE_TAG_HEADER, String.join(",", tags))
            .bodyValue(value)
            .retrieve()
            .toBodilessEntity()
            .then();
    }

    @Override
    @CircuitBreaker(name = "edgeKeyValueStore", fallbackMethod = "deleteFallback")
    public Mono<Void> delete(String key) {
        return webClient.delete()
            .uri(uriBuilder -> uriBuilder.path("/values/{key}").build(key))
            .retrieve()
            .toBodilessEntity()
            .onErrorResume(WebClientResponseException.NotFound.class, ex -> Mono.empty())
            .then();
    }

    @Override
    @CircuitBreaker(name = "edgeKeyValueStore", fallbackMethod = "purgeFallback")
    public Mono<Void> purgeTags(Collection<String> tags) {
        if (!supportsTagPurge() || tags.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(batches(List.copyOf(tags), purgeBatchSize))
            .concatMap(batch -> webClient.post()
                .uri(purgeUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("tags", batch))
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(response -> log.debug("Edge purge accepted {} tags", batch.size())))
            .then();
    }

    @Override
    public boolean supportsTagPurge() {
        return StringUtils.hasText(purgeUrl);
    }

    private Mono<String> getFallback(String key, Throwable throwable) {
        return Mono.error(new CacheTierException(EdgeCacheTier.NAME, "read of " + key + " failed", throwable));
    }

    private Mono<Void> writeFallback(String key, String value, Duration ttl, Set<String> tags, Throwable throwable) {
        return Mono.error(new CacheTierException(EdgeCacheTier.NAME, "write of " + key + " failed", throwable));
    }

    private Mono<Void> deleteFallback(String key, Throwable throwable) {
        return Mono.error(new CacheTierException(EdgeCacheTier.NAME, "delete of " + key + " failed", throwable));
    }

    private Mono<Void> purgeFallback(Collection<String> tags, Throwable throwable) {
        return Mono.error(new CacheTierException(EdgeCacheTier.NAME, "purge of " + tags.size() + " tags failed", throwable));
    }

    static <T> List<List<T>> batches(List<T> items, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += batchSize) {
            batches.add(items.subList(start, Math.min(items.size(), start + batchSize)));
        }
        return batches;
    }
}
