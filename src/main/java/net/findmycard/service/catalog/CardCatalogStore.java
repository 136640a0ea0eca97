package net.findmycard.service.catalog;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import net.findmycard.exception.CatalogUnavailableException;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.repository.CardPrintingRepository;
import net.findmycard.service.event.CatalogMutationEvent;
import net.findmycard.service.event.CatalogRefreshedEvent;
import net.findmycard.service.identity.IdentityIndex;
import net.findmycard.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Holds the current {@link CatalogSnapshot} and swaps it atomically when printings change.
 *
 * <p>Readers always see one complete snapshot. The first read loads the catalog from the
 * repository; later rebuilds are driven by {@link CatalogMutationEvent}s. When a rebuild
 * fails the previous snapshot keeps serving.</p>
 */
@Service
public class CardCatalogStore {

    private static final Logger log = LoggerFactory.getLogger(CardCatalogStore.class);

    private final CardPrintingRepository printingRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private final Object rebuildLock = new Object();

    public CardCatalogStore(CardPrintingRepository printingRepository,
                            ApplicationEventPublisher eventPublisher) {
        this.printingRepository = printingRepository;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Current snapshot, loading it on first use.
     *
     * @throws CatalogUnavailableException if the repository cannot be enumerated and nothing was loaded before
     */
    public CatalogSnapshot snapshot() {
        CatalogSnapshot snapshot = current.get();
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (rebuildLock) {
            snapshot = current.get();
            if (snapshot == null) {
                snapshot = rebuild();
                current.set(snapshot);
            }
            return snapshot;
        }
    }

    /**
     * Version of the live snapshot without triggering a load; 0 before the first load.
     */
    public long currentVersion() {
        CatalogSnapshot snapshot = current.get();
        return snapshot == null ? 0L : snapshot.version();
    }

    public Optional<CardIdentity> getByKey(CardIdentityKey key) {
        return snapshot().getByKey(key);
    }

    public List<CardPrinting> getAllForIdentity(CardIdentityKey key) {
        return snapshot().getAllForIdentity(key);
    }

    public List<CardIdentity> listIdentities() {
        return snapshot().listIdentities();
    }

    /**
     * Image of the printing that represents {@code key}, if it has one.
     */
    public Optional<String> imageUrlFor(CardIdentityKey key) {
        return snapshot().representativeOf(key).flatMap(CardPrinting::primaryImageUrl);
    }

    @EventListener
    public void onCatalogMutation(CatalogMutationEvent event) {
        CatalogRefreshedEvent refreshed;
        synchronized (rebuildLock) {
            CatalogSnapshot previous = current.get();
            CatalogSnapshot next = rebuild();
            current.set(next);
            refreshed = new CatalogRefreshedEvent(touchedKeys(previous, next, event.getPrintingIds()),
                event.isFullReplace(), next.version());
            log.info("Catalog snapshot v{} swapped in after {} ({}): {} identities, {} touched",
                next.version(), event.getKind(), event.getContext(), next.identityCount(),
                refreshed.getTouchedKeys().size());
        }
        eventPublisher.publishEvent(refreshed);
    }

    private CatalogSnapshot rebuild() {
        List<CardPrinting> printings;
        try {
            printings = printingRepository.findAll();
        } catch (DataAccessException ex) {
            LoggingUtils.error(log, ex, "Card printing repository could not be enumerated");
            throw new CatalogUnavailableException("Card catalog is unavailable", ex);
        }
        CatalogSnapshot snapshot = CatalogSnapshot.build(printings, versions.incrementAndGet());
        for (IdentityIndex.Ambiguity ambiguity : snapshot.ambiguities()) {
            log.warn("Identity ambiguity: oracle ids {} share a name and rules text; using {}",
                ambiguity.oracleIds(), ambiguity.chosenKey());
        }
        log.debug("Built catalog snapshot v{} from {} printings into {} identities",
            snapshot.version(), snapshot.printingCount(), snapshot.identityCount());
        return snapshot;
    }

    /**
     * Keys whose cached data may be stale: the old and new key of every touched printing,
     * plus keys that disappeared because their group was merged or removed.
     */
    private static Set<CardIdentityKey> touchedKeys(CatalogSnapshot previous,
                                                    CatalogSnapshot next,
                                                    Set<String> printingIds) {
        Set<CardIdentityKey> touched = new HashSet<>();
        for (String printingId : printingIds) {
            next.keyForPrinting(printingId).ifPresent(touched::add);
            if (previous != null) {
                previous.keyForPrinting(printingId).ifPresent(touched::add);
            }
        }
        if (previous != null) {
            for (CardIdentity identity : previous.listIdentities()) {
                if (next.getByKey(identity.key()).isEmpty()) {
                    touched.add(identity.key());
                }
            }
        }
        return touched;
    }
}
