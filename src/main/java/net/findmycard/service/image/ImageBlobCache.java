package net.findmycard.service.image;

import com.github.benmanes.caffeine.cache.Cache;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import net.findmycard.config.CacheFactory;
import net.findmycard.util.HashUtils;
import net.findmycard.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.unit.DataSize;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Content-addressed store of card images.
 *
 * <p>Blobs are keyed by the SHA-256 of their source URL and written to local disk under a
 * two-character shard directory, with a byte-bounded Caffeine cache in front. Image URLs
 * are immutable per printing, so blobs are never invalidated.</p>
 */
@Service
public class ImageBlobCache {

    private static final Logger log = LoggerFactory.getLogger(ImageBlobCache.class);
    private static final String BLOB_SUFFIX = ".img";

    private final ImageFetcher imageFetcher;
    private final Cache<String, byte[]> memory;
    private final Path directory;

    public ImageBlobCache(ImageFetcher imageFetcher,
                          CacheFactory cacheFactory,
                          @Value("${app.images.cache-dir:${java.io.tmpdir}/findmycard-images}") String cacheDir,
                          @Value("${app.images.memory-size:64MB}") DataSize memorySize) {
        this.imageFetcher = imageFetcher;
        this.memory = cacheFactory.createByteWeightedCache("image-blobs", memorySize.toBytes());
        this.directory = Paths.get(cacheDir);
    }

    /**
     * Cache key of an image URL.
     */
    public String blobKey(String url) {
        return HashUtils.sha256HexPrefix(url, 64);
    }

    public boolean isCached(String url) {
        String key = blobKey(url);
        return memory.getIfPresent(key) != null || Files.isRegularFile(blobPath(key));
    }

    /**
     * Cached bytes from memory or disk, without fetching.
     */
    public Optional<byte[]> getCached(String url) {
        String key = blobKey(url);
        byte[] inMemory = memory.getIfPresent(key);
        if (inMemory != null) {
            return Optional.of(inMemory);
        }
        Path path = blobPath(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            byte[] onDisk = Files.readAllBytes(path);
            memory.put(key, onDisk);
            return Optional.of(onDisk);
        } catch (IOException ex) {
            LoggingUtils.warn(log, ex, "Unreadable image blob {} for {}; refetching", key, url);
            return Optional.empty();
        }
    }

    /**
     * Cached bytes, or bytes fetched from {@code url} and stored on disk and in memory.
     */
    public Mono<byte[]> getOrFetch(String url) {
        return Mono.fromCallable(() -> getCached(url))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(cached -> cached.map(Mono::just)
                .orElseGet(() -> imageFetcher.fetch(url)
                    .flatMap(bytes -> Mono.fromCallable(() -> store(url, bytes))
                        .subscribeOn(Schedulers.boundedElastic()))));
    }

    private byte[] store(String url, byte[] bytes) {
        if (bytes.length == 0) {
            throw new IllegalStateException("Empty image body for " + url);
        }
        String key = blobKey(url);
        Path target = blobPath(key);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), key, ".tmp");
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write image blob " + key, ex);
        }
        memory.put(key, bytes);
        log.debug("Stored image blob {} ({} bytes) for {}", key, bytes.length, url);
        return bytes;
    }

    Path blobPath(String key) {
        return directory.resolve(key.substring(0, 2)).resolve(key + BLOB_SUFFIX);
    }
}
