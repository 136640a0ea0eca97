package net.findmycard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import net.findmycard.config.CacheTierProperties;
import net.findmycard.exception.CardNotFoundException;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.service.cache.CacheCoordinator;
import net.findmycard.service.cache.CacheKeys;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.catalog.CatalogSnapshot;
import net.findmycard.service.identity.CardIdentityResolver;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Card lookup by any accepted reference, cached per identity under its {@code card-<key>} tag.
 */
@Service
public class CardDetailService {

    private final CardCatalogStore catalogStore;
    private final CardIdentityResolver identityResolver;
    private final CacheCoordinator cacheCoordinator;
    private final ObjectMapper objectMapper;
    private final Duration cardTtl;

    public CardDetailService(CardCatalogStore catalogStore,
                             CardIdentityResolver identityResolver,
                             CacheCoordinator cacheCoordinator,
                             ObjectMapper objectMapper,
                             CacheTierProperties cacheProperties) {
        this.catalogStore = catalogStore;
        this.identityResolver = identityResolver;
        this.cacheCoordinator = cacheCoordinator;
        this.objectMapper = objectMapper;
        this.cardTtl = cacheProperties.getTtl().getCard();
    }

    public Mono<CardDetail> findCard(String reference) {
        return Mono.fromCallable(() -> findCardNow(reference))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * @throws CardNotFoundException when nothing matches {@code reference}
     */
    public CardDetail findCardNow(String reference) {
        CatalogSnapshot snapshot = catalogStore.snapshot();
        CardIdentityKey key = identityResolver.resolve(reference, snapshot);
        return cacheCoordinator.getOrCompute(
            CacheKeys.card(key),
            objectMapper.constructType(CardDetail.class),
            cardTtl,
            CacheKeys.cardTags(key),
            () -> assemble(key, reference, snapshot),
            () -> catalogStore.currentVersion() == snapshot.version());
    }

    private static CardDetail assemble(CardIdentityKey key, String reference, CatalogSnapshot snapshot) {
        CardIdentity identity = snapshot.getByKey(key).orElseThrow(() -> new CardNotFoundException(reference));
        List<CardPrinting> printings = new ArrayList<>(snapshot.getAllForIdentity(key));
        snapshot.representativeOf(key).ifPresent(representative -> {
            printings.remove(representative);
            printings.add(0, representative);
        });
        return new CardDetail(identity, printings);
    }
}
