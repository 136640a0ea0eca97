package net.findmycard.service.cache;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.findmycard.config.CacheTierProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class HttpEdgeKeyValueStoreTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private HttpEdgeKeyValueStore store(String purgeUrl, HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            ClientResponse.Builder response = ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE);
            if (body != null) {
                response.body(body);
            }
            return Mono.just(response.build());
        };
        CacheTierProperties properties = new CacheTierProperties();
        properties.getEdge().setEnabled(true);
        properties.getEdge().setBaseUrl("https://kv.example.test/ns");
        properties.getEdge().setPurgeUrl(purgeUrl);
        properties.getEdge().setApiToken("secret-token");
        properties.getEdge().setPurgeBatchSize(2);
        return new HttpEdgeKeyValueStore(WebClient.builder().exchangeFunction(exchange), properties);
    }

    @Test
    void should_ReturnStoredValue_When_KeyExists() {
        HttpEdgeKeyValueStore store = store(null, HttpStatus.OK, "{\"value\":1}");

        StepVerifier.create(store.get("card-o-shock"))
            .expectNext("{\"value\":1}")
            .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getPath()).isEqualTo("/ns/values/card-o-shock");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-token");
    }

    @Test
    void should_CompleteEmpty_When_StoreAnswersNotFound() {
        HttpEdgeKeyValueStore store = store(null, HttpStatus.NOT_FOUND, null);

        StepVerifier.create(store.get("missing")).verifyComplete();
    }

    @Test
    void should_ErrorOnServerFailure_When_ReadingWithoutCircuitBreakerProxy() {
        HttpEdgeKeyValueStore store = store(null, HttpStatus.SERVICE_UNAVAILABLE, null);

        StepVerifier.create(store.get("card-o-shock")).expectError().verify();
    }

    @Test
    void should_SendTagsAndMinimumExpiration_When_Putting() {
        HttpEdgeKeyValueStore store = store(null, HttpStatus.OK, null);

        store.put("search-abc", "{}", Duration.ofSeconds(5), Set.of("search")).block();

        ClientRequest request = requests.get(0);
        URI url = request.url();
        assertThat(request.method()).isEqualTo(HttpMethod.PUT);
        assertThat(url.getQuery()).isEqualTo("expiration_ttl=60");
        assertThat(request.headers().getFirst(HttpEdgeKeyValueStore.CACHE_TAG_HEADER)).isEqualTo("search");
    }

    @Test
    void should_PurgeInBatches_When_PurgeEndpointIsConfigured() {
        HttpEdgeKeyValueStore store = store("https://purge.example.test/cache/purge", HttpStatus.OK, null);

        store.purgeTags(List.of("card-a", "card-b", "card-c")).block();

        assertThat(store.supportsTagPurge()).isTrue();
        assertThat(requests).hasSize(2);
        assertThat(requests).allSatisfy(request -> {
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            assertThat(request.url().getHost()).isEqualTo("purge.example.test");
        });
    }

    @Test
    void should_SkipPurge_When_NoPurgeEndpointIsConfigured() {
        HttpEdgeKeyValueStore store = store(" ", HttpStatus.OK, null);

        store.purgeTags(List.of("card-a")).block();

        assertThat(store.supportsTagPurge()).isFalse();
        assertThat(requests).isEmpty();
    }

    @Test
    void should_SplitIntoFixedSizeBatches() {
        assertThat(HttpEdgeKeyValueStore.batches(List.of(1, 2, 3, 4, 5), 2))
            .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }
}
