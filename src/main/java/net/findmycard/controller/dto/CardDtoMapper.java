package net.findmycard.controller.dto;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.findmycard.model.CardFace;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardPrinting;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;
import net.findmycard.service.CardDetail;
import net.findmycard.service.CardSearchHit;
import net.findmycard.service.CardSearchPage;
import net.findmycard.service.IngestionResult;
import net.findmycard.service.scoring.Recommendation;

/**
 * Maps domain records to API payloads. Sets are emitted as sorted lists so responses are stable.
 */
public final class CardDtoMapper {

    private CardDtoMapper() {
    }

    public static CardDto toCardDto(CardIdentity identity, String imageUrl) {
        Map<String, String> legalities = new TreeMap<>();
        identity.legalities().forEach((format, legality) -> legalities.put(format, legality.wireValue()));
        return new CardDto(
            identity.key().toString(),
            identity.oracleId(),
            identity.name(),
            identity.typeLine(),
            identity.oracleText(),
            identity.manaCost(),
            identity.convertedManaCost(),
            colorSymbols(identity.colors()),
            colorSymbols(identity.colorIdentity()),
            identity.keywords().stream().sorted().toList(),
            identity.rarities().stream().sorted().map(Rarity::wireValue).toList(),
            legalities,
            identity.setCodes().stream().sorted().toList(),
            identity.lowestPriceUsd(),
            imageUrl);
    }

    public static PrintingDto toPrintingDto(CardPrinting printing) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        prices.put("usd", printing.prices().usd());
        prices.put("usd_foil", printing.prices().usdFoil());
        prices.put("eur", printing.prices().eur());
        prices.put("tix", printing.prices().tix());
        return new PrintingDto(
            printing.printingId(),
            printing.oracleId(),
            printing.name(),
            printing.setCode(),
            printing.setName(),
            printing.rarity() == null ? null : printing.rarity().wireValue(),
            printing.imageUris(),
            printing.cardFaces().stream().map(CardDtoMapper::toFaceDto).toList(),
            prices,
            printing.power(),
            printing.toughness());
    }

    public static RecommendationDto toRecommendationDto(Recommendation recommendation, String imageUrl) {
        return new RecommendationDto(toCardDto(recommendation.candidate(), imageUrl),
            recommendation.score(), recommendation.reason());
    }

    public static CardSearchResponse toSearchResponse(CardSearchPage page) {
        List<CardSearchHitDto> rows = page.data().stream()
            .map(CardDtoMapper::toSearchHitDto)
            .toList();
        return new CardSearchResponse(rows, page.hasMore(), page.totalCards(), page.page(), page.nextPage());
    }

    public static CardDetailDto toDetailDto(CardDetail detail) {
        String imageUrl = detail.printings().isEmpty()
            ? null
            : detail.printings().get(0).primaryImageUrl().orElse(null);
        return new CardDetailDto(toCardDto(detail.identity(), imageUrl),
            detail.printings().stream().map(CardDtoMapper::toPrintingDto).toList());
    }

    public static IngestionResultDto toIngestionResultDto(IngestionResult result) {
        return new IngestionResultDto(result.received(), result.stored(), result.skipped());
    }

    private static CardSearchHitDto toSearchHitDto(CardSearchHit hit) {
        return new CardSearchHitDto(
            toCardDto(hit.identity(), hit.representative().primaryImageUrl().orElse(null)),
            toPrintingDto(hit.representative()));
    }

    private static PrintingDto.FaceDto toFaceDto(CardFace face) {
        return new PrintingDto.FaceDto(face.name(), face.manaCost(), face.typeLine(), face.oracleText(), face.imageUris());
    }

    private static List<String> colorSymbols(Collection<ManaColor> colors) {
        return colors.stream()
            .sorted(Comparator.naturalOrder())
            .map(ManaColor::name)
            .toList();
    }
}
