package net.findmycard.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.findmycard.exception.InvalidRequestException;
import net.findmycard.mapper.ScryfallCardMapper;
import net.findmycard.model.CardPrinting;
import net.findmycard.repository.CardPrintingRepository;
import net.findmycard.service.event.CatalogMutationEvent;
import net.findmycard.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Writes printings to the repository and announces each write with a {@link CatalogMutationEvent}.
 *
 * <p>Every write publishes exactly one event after the repository call returns, so the
 * catalog snapshot is rebuilt once per write and caches are purged only after the new
 * snapshot is visible.</p>
 */
@Service
public class CatalogIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CatalogIngestionService.class);

    private final CardPrintingRepository printingRepository;
    private final ScryfallCardMapper cardMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final int batchSize;

    public CatalogIngestionService(CardPrintingRepository printingRepository,
                                   ScryfallCardMapper cardMapper,
                                   ApplicationEventPublisher eventPublisher,
                                   @Value("${app.catalog.import.batch-size:1000}") int batchSize) {
        this.printingRepository = printingRepository;
        this.cardMapper = cardMapper;
        this.eventPublisher = eventPublisher;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Incremental upsert of Scryfall card objects.
     */
    public IngestionResult upsertCards(JsonNode cards, String context) {
        List<CardPrinting> printings = mapAll(cards);
        int received = size(cards);
        if (printings.isEmpty()) {
            return new IngestionResult(received, 0, received);
        }
        int stored = printingRepository.upsertAll(printings);
        publish(CatalogMutationEvent.Kind.UPSERT, printings, context);
        return new IngestionResult(received, stored, received - printings.size());
    }

    /**
     * Replaces the whole catalog with the given Scryfall card objects.
     *
     * @throws InvalidRequestException when no object maps to a printing, so a bad payload cannot empty the catalog
     */
    public IngestionResult reimportCards(JsonNode cards, String context) {
        List<CardPrinting> printings = mapAll(cards);
        int received = size(cards);
        if (printings.isEmpty()) {
            throw new InvalidRequestException("Re-import payload contained no valid cards");
        }
        int stored = printingRepository.replaceAll(printings);
        publish(CatalogMutationEvent.Kind.REIMPORT, printings, context);
        log.info("Catalog re-imported from {}: {} printings stored, {} skipped", context, stored, received - printings.size());
        return new IngestionResult(received, stored, received - printings.size());
    }

    /**
     * Refreshes prices and legalities of printings that already exist; other fields are left untouched.
     */
    public IngestionResult refreshMarketData(JsonNode cards, String context) {
        requireArray(cards);
        List<CardPrinting> refreshed = new ArrayList<>();
        int received = size(cards);
        for (JsonNode card : cards) {
            String printingId = card.path("id").asText(null);
            if (!ValidationUtils.hasText(printingId)) {
                continue;
            }
            Optional<CardPrinting> existing = printingRepository.findById(printingId);
            existing.ifPresent(printing -> refreshed.add(
                printing.withMarketData(cardMapper.prices(card), cardMapper.legalities(card))));
        }
        if (refreshed.isEmpty()) {
            return new IngestionResult(received, 0, received);
        }
        int stored = printingRepository.upsertAll(refreshed);
        publish(CatalogMutationEvent.Kind.MARKET_DATA, refreshed, context);
        return new IngestionResult(received, stored, received - refreshed.size());
    }

    /**
     * Upserts a stream of Scryfall card objects in repository batches and announces them with one event.
     */
    public IngestionResult importStream(Iterator<JsonNode> cards, String context) {
        int received = 0;
        int stored = 0;
        Set<String> writtenIds = new LinkedHashSet<>();
        List<CardPrinting> batch = new ArrayList<>(batchSize);
        while (cards.hasNext()) {
            received++;
            cardMapper.toPrinting(cards.next()).ifPresent(batch::add);
            if (batch.size() >= batchSize) {
                stored += flush(batch, writtenIds);
                log.info("Imported {} printings from {} so far", stored, context);
            }
        }
        stored += flush(batch, writtenIds);
        if (!writtenIds.isEmpty()) {
            eventPublisher.publishEvent(new CatalogMutationEvent(CatalogMutationEvent.Kind.UPSERT, writtenIds, context));
        }
        return new IngestionResult(received, stored, received - writtenIds.size());
    }

    private int flush(List<CardPrinting> batch, Set<String> writtenIds) {
        if (batch.isEmpty()) {
            return 0;
        }
        int stored = printingRepository.upsertAll(batch);
        batch.forEach(printing -> writtenIds.add(printing.printingId()));
        batch.clear();
        return stored;
    }

    private List<CardPrinting> mapAll(JsonNode cards) {
        requireArray(cards);
        List<CardPrinting> printings = new ArrayList<>(cards.size());
        for (JsonNode card : cards) {
            cardMapper.toPrinting(card).ifPresent(printings::add);
        }
        return printings;
    }

    private void publish(CatalogMutationEvent.Kind kind, List<CardPrinting> printings, String context) {
        Set<String> ids = new LinkedHashSet<>();
        printings.forEach(printing -> ids.add(printing.printingId()));
        eventPublisher.publishEvent(new CatalogMutationEvent(kind, ids, context));
    }

    private static void requireArray(JsonNode cards) {
        if (cards == null || !cards.isArray()) {
            throw new InvalidRequestException("Expected a JSON array of card objects");
        }
    }

    private static int size(JsonNode cards) {
        return cards != null && cards.isArray() ? cards.size() : 0;
    }
}
