package net.findmycard.service.image;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.findmycard.util.LoggingUtils;
import net.findmycard.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Warms the {@link ImageBlobCache} in the background.
 *
 * <p>Tasks run on a bounded pool of daemon threads. Each task makes a single attempt bounded
 * by its own timeout; failures are logged and dropped. A URL already queued or running is not
 * submitted twice.</p>
 */
@Service
public class CardImagePreloader {

    private static final Logger log = LoggerFactory.getLogger(CardImagePreloader.class);

    /** Images of a result page preloaded without delay. */
    public static final int IMMEDIATE_RESULT_IMAGES = 20;

    private final ImageBlobCache imageBlobCache;
    private final Duration deferDelay;
    private final Duration taskTimeout;
    private final ThreadPoolExecutor executor;
    private final ScheduledExecutorService deferralScheduler;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public CardImagePreloader(ImageBlobCache imageBlobCache,
                              @Value("${app.images.preload.defer-delay:1s}") Duration deferDelay,
                              @Value("${app.images.preload.task-timeout:10s}") Duration taskTimeout,
                              @Value("${app.images.preload.threads:4}") int threads,
                              @Value("${app.images.preload.queue-capacity:500}") int queueCapacity) {
        this.imageBlobCache = imageBlobCache;
        this.deferDelay = deferDelay;
        this.taskTimeout = taskTimeout;
        this.executor = new ThreadPoolExecutor(
            threads,
            threads,
            30L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            daemonThreads("card-image-preload-"),
            new ThreadPoolExecutor.AbortPolicy());
        this.executor.allowCoreThreadTimeOut(true);
        this.deferralScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("card-image-defer-"));
    }

    /**
     * Preload one image.
     *
     * @return {@code false} when the URL was blank, already cached or already in flight
     */
    public boolean preload(String url, PreloadPriority priority) {
        if (!ValidationUtils.hasText(url)) {
            return false;
        }
        if (imageBlobCache.isCached(url) || !inFlight.add(url)) {
            return false;
        }
        try {
            if (priority == PreloadPriority.DEFERRED) {
                deferralScheduler.schedule(() -> submit(url), deferDelay.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                submit(url);
            }
            return true;
        } catch (RejectedExecutionException ex) {
            inFlight.remove(url);
            log.debug("Preload scheduler is shut down; skipping {}", url);
            return false;
        }
    }

    /**
     * Preload the images of an ordered result set: the first {@value #IMMEDIATE_RESULT_IMAGES}
     * immediately, the rest deferred.
     *
     * @return number of preloads actually scheduled
     */
    public int preloadResultImages(Collection<String> orderedUrls) {
        if (orderedUrls == null || orderedUrls.isEmpty()) {
            return 0;
        }
        List<String> distinct = List.copyOf(new LinkedHashSet<>(orderedUrls.stream()
            .filter(ValidationUtils::hasText)
            .toList()));
        int scheduled = 0;
        for (int i = 0; i < distinct.size(); i++) {
            PreloadPriority priority = i < IMMEDIATE_RESULT_IMAGES ? PreloadPriority.IMMEDIATE : PreloadPriority.DEFERRED;
            if (preload(distinct.get(i), priority)) {
                scheduled++;
            }
        }
        return scheduled;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void submit(String url) {
        try {
            executor.execute(() -> runPreload(url));
        } catch (RejectedExecutionException ex) {
            inFlight.remove(url);
            log.debug("Preload queue full; dropping {}", url);
        }
    }

    private void runPreload(String url) {
        try {
            imageBlobCache.getOrFetch(url).block(taskTimeout);
            log.debug("Preloaded card image {}", url);
        } catch (RuntimeException ex) {
            LoggingUtils.warn(log, null, "Card image preload failed for {}: {}", url, LoggingUtils.describe(ex));
        } finally {
            inFlight.remove(url);
        }
    }

    @PreDestroy
    public void shutdown() {
        deferralScheduler.shutdownNow();
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
