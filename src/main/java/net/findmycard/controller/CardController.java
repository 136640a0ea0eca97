package net.findmycard.controller;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.findmycard.controller.dto.CardDetailDto;
import net.findmycard.controller.dto.CardDtoMapper;
import net.findmycard.controller.dto.CardSearchResponse;
import net.findmycard.controller.dto.RecommendationDto;
import net.findmycard.service.CardDetailService;
import net.findmycard.service.CardSearchRequest;
import net.findmycard.service.CardSearchService;
import net.findmycard.service.RecommendationRequest;
import net.findmycard.service.RecommendationService;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.filter.CardFilterParser;
import net.findmycard.service.filter.CardFilters;
import net.findmycard.service.filter.FacetInput;
import net.findmycard.service.scoring.RecommendationStrategy;
import net.findmycard.util.ReactiveControllerUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Card search, detail and recommendation APIs.
 */
@RestController
@RequestMapping("/api/cards")
@Slf4j
public class CardController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final RecommendationService recommendationService;
    private final CardSearchService cardSearchService;
    private final CardDetailService cardDetailService;
    private final CardCatalogStore catalogStore;
    private final CardFilterParser filterParser;

    public CardController(RecommendationService recommendationService,
                          CardSearchService cardSearchService,
                          CardDetailService cardDetailService,
                          CardCatalogStore catalogStore,
                          CardFilterParser filterParser) {
        this.recommendationService = recommendationService;
        this.cardSearchService = cardSearchService;
        this.cardDetailService = cardDetailService;
        this.catalogStore = catalogStore;
        this.filterParser = filterParser;
    }

    /**
     * Search facets bound from query parameters by name. List facets accept comma-separated values.
     */
    record SearchParams(String q,
                        List<String> colors,
                        List<String> colorIdentity,
                        List<String> types,
                        List<String> rarities,
                        String format,
                        String minMv,
                        String maxMv,
                        String minPrice,
                        String maxPrice,
                        String oracleText,
                        List<String> sets,
                        String power,
                        String toughness,
                        List<String> keywords,
                        String includeMulticolored,
                        Integer page,
                        Integer pageSize) {

        FacetInput facets() {
            return new FacetInput(colors, colorIdentity, types, rarities, format,
                minMv, maxMv, minPrice, maxPrice, oracleText, sets,
                power, toughness, keywords, includeMulticolored);
        }
    }

    @GetMapping("/{id}/recommendations")
    public Mono<ResponseEntity<List<RecommendationDto>>> getRecommendations(
            @PathVariable("id") String cardId,
            @RequestParam(name = "type", defaultValue = "synergy") String type,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "filters", required = false) String filtersJson,
            @RequestHeader(name = USER_ID_HEADER, required = false) String requesterId) {
        RecommendationStrategy strategy = RecommendationStrategy.fromWireValue(type)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Unknown recommendation type '" + type + "'; expected synergy or functional_similarity"));
        CardFilters filters = filterParser.parseJson(filtersJson);
        RecommendationRequest request = new RecommendationRequest(cardId, strategy, limit, filters, requesterId);

        Mono<List<RecommendationDto>> body = recommendationService.recommend(request)
            .map(recommendations -> recommendations.stream()
                .map(recommendation -> CardDtoMapper.toRecommendationDto(recommendation,
                    catalogStore.imageUrlFor(recommendation.candidate().key()).orElse(null)))
                .toList());
        return ReactiveControllerUtils.ok(body, "Recommendations for " + cardId);
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<CardSearchResponse>> searchCards(SearchParams params) {
        CardFilters filters = filterParser.validate(params.facets());
        CardSearchRequest request = CardSearchRequest.of(params.q(), filters, params.page(), params.pageSize());
        Mono<CardSearchResponse> body = cardSearchService.search(request)
            .map(CardDtoMapper::toSearchResponse);
        return ReactiveControllerUtils.ok(body, "Card search '" + request.query() + "'");
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<CardDetailDto>> getCard(@PathVariable("id") String cardId) {
        Mono<CardDetailDto> body = cardDetailService.findCard(cardId)
            .map(CardDtoMapper::toDetailDto);
        return ReactiveControllerUtils.ok(body, "Card lookup " + cardId);
    }
}
