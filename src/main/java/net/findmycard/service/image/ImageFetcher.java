package net.findmycard.service.image;

import reactor.core.publisher.Mono;

/**
 * Downloads raw image bytes.
 */
public interface ImageFetcher {

    /**
     * @return the image bytes, or an error when the URL cannot be fetched
     */
    Mono<byte[]> fetch(String url);
}
