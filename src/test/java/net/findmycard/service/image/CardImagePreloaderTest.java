package net.findmycard.service.image;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CardImagePreloaderTest {

    private static final byte[] IMAGE = {1, 2, 3};

    @Mock
    private ImageBlobCache imageBlobCache;

    private CardImagePreloader preloader;

    @BeforeEach
    void setUp() {
        preloader = new CardImagePreloader(imageBlobCache, Duration.ofMillis(100), Duration.ofSeconds(2), 2, 100);
    }

    @AfterEach
    void tearDown() {
        preloader.shutdown();
    }

    @Test
    void should_FetchImageOnce_When_SameUrlIsRequestedWhileInFlight() {
        when(imageBlobCache.getOrFetch("https://img.test/a.jpg")).thenReturn(Mono.never());

        assertThat(preloader.preload("https://img.test/a.jpg", PreloadPriority.IMMEDIATE)).isTrue();
        assertThat(preloader.preload("https://img.test/a.jpg", PreloadPriority.IMMEDIATE)).isFalse();

        verify(imageBlobCache, timeout(1000)).getOrFetch("https://img.test/a.jpg");
        assertThat(preloader.inFlightCount()).isEqualTo(1);
    }

    @Test
    void should_SkipPreload_When_ImageIsAlreadyCachedOrUrlIsBlank() {
        when(imageBlobCache.isCached("https://img.test/cached.jpg")).thenReturn(true);

        assertThat(preloader.preload("https://img.test/cached.jpg", PreloadPriority.IMMEDIATE)).isFalse();
        assertThat(preloader.preload(" ", PreloadPriority.IMMEDIATE)).isFalse();

        verify(imageBlobCache, never()).getOrFetch(anyString());
    }

    @Test
    void should_ScheduleEveryDistinctResultImage_When_ResultHasMoreThanImmediateBudget() {
        when(imageBlobCache.getOrFetch(anyString())).thenReturn(Mono.just(IMAGE));
        List<String> urls = new ArrayList<>(IntStream.range(0, 25)
            .mapToObj(i -> "https://img.test/" + i + ".jpg")
            .toList());
        urls.add("https://img.test/0.jpg");
        urls.add("");

        int scheduled = preloader.preloadResultImages(urls);

        assertThat(scheduled).isEqualTo(25);
        verify(imageBlobCache, timeout(2000)).getOrFetch("https://img.test/0.jpg");
        verify(imageBlobCache, timeout(2000)).getOrFetch("https://img.test/24.jpg");
    }

    @Test
    void should_ReleaseUrl_When_PreloadFails() throws InterruptedException {
        when(imageBlobCache.getOrFetch("https://img.test/broken.jpg"))
            .thenReturn(Mono.error(new IllegalStateException("Empty image body")));

        assertThat(preloader.preload("https://img.test/broken.jpg", PreloadPriority.IMMEDIATE)).isTrue();

        verify(imageBlobCache, timeout(1000)).getOrFetch("https://img.test/broken.jpg");
        long deadline = System.currentTimeMillis() + 2000;
        while (preloader.inFlightCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(preloader.inFlightCount()).isZero();
    }
}
