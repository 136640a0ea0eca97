package net.findmycard.service.image;

import java.net.URI;
import java.util.Locale;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Fetches card images over HTTP(S) with the shared WebClient configuration.
 */
@Component
public class WebClientImageFetcher implements ImageFetcher {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    private final WebClient webClient;

    public WebClientImageFetcher(WebClient.Builder webClientBuilder,
                                 @Value("${app.images.max-download-size:5MB}") DataSize maxDownloadSize) {
        this.webClient = webClientBuilder.clone()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize((int) maxDownloadSize.toBytes()))
            .build();
    }

    @Override
    public Mono<byte[]> fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException ex) {
            return Mono.error(new IllegalArgumentException("Malformed image URL: " + url, ex));
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            return Mono.error(new IllegalArgumentException("Unsupported image URL scheme: " + url));
        }
        return webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(byte[].class);
    }
}
