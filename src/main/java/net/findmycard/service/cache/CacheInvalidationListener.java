package net.findmycard.service.cache;

import java.util.LinkedHashSet;
import java.util.Set;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.service.event.CatalogRefreshedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Purges cached responses once a rebuilt catalog snapshot is live.
 *
 * <p>Every touched identity loses its {@code card-<key>} entries, and search and
 * recommendation results are dropped wholesale because any catalog write can change
 * their membership. A full re-import purges every catalog-derived entry.</p>
 */
@Component
public class CacheInvalidationListener {

    private static final Logger log = LoggerFactory.getLogger(CacheInvalidationListener.class);

    private final CacheCoordinator cacheCoordinator;

    public CacheInvalidationListener(CacheCoordinator cacheCoordinator) {
        this.cacheCoordinator = cacheCoordinator;
    }

    @EventListener
    public void onCatalogRefreshed(CatalogRefreshedEvent event) {
        Set<String> tags = new LinkedHashSet<>();
        if (event.isFullReplace()) {
            tags.add(CacheKeys.CATALOG_TAG);
        } else {
            for (CardIdentityKey key : event.getTouchedKeys()) {
                tags.add(CacheKeys.cardTag(key));
            }
        }
        tags.add(CacheKeys.SEARCH_TAG);
        tags.add(CacheKeys.RECOMMENDATIONS_TAG);
        cacheCoordinator.invalidateTags(tags);
        log.info("Purged {} cache tags after catalog snapshot v{} ({} identities touched, full replace: {})",
            tags.size(), event.getSnapshotVersion(), event.getTouchedKeys().size(), event.isFullReplace());
    }
}
