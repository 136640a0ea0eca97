package net.findmycard.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import net.findmycard.controller.dto.CardDtoMapper;
import net.findmycard.controller.dto.IngestionResultDto;
import net.findmycard.service.CatalogIngestionService;
import net.findmycard.service.IngestionResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Catalog ingestion endpoints. Each accepts a JSON array of Scryfall card objects.
 * Access control is handled in front of the application.
 */
@RestController
@RequestMapping("/api/admin/catalog")
@Slf4j
public class CatalogAdminController {

    private final CatalogIngestionService ingestionService;

    public CatalogAdminController(CatalogIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/printings")
    public ResponseEntity<IngestionResultDto> upsertPrintings(@RequestBody JsonNode cards) {
        IngestionResult result = ingestionService.upsertCards(cards, "admin upsert");
        log.info("Admin upsert: {} received, {} stored, {} skipped", result.received(), result.stored(), result.skipped());
        return ResponseEntity.ok(CardDtoMapper.toIngestionResultDto(result));
    }

    @PostMapping("/reimport")
    public ResponseEntity<IngestionResultDto> reimport(@RequestBody JsonNode cards) {
        IngestionResult result = ingestionService.reimportCards(cards, "admin reimport");
        return ResponseEntity.ok(CardDtoMapper.toIngestionResultDto(result));
    }

    @PostMapping("/prices")
    public ResponseEntity<IngestionResultDto> refreshPrices(@RequestBody JsonNode cards) {
        IngestionResult result = ingestionService.refreshMarketData(cards, "admin market data");
        log.info("Admin market data refresh: {} received, {} updated", result.received(), result.stored());
        return ResponseEntity.ok(CardDtoMapper.toIngestionResultDto(result));
    }
}
