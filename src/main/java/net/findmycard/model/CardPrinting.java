package net.findmycard.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A single edition of a card as ingested from the card-data feed.
 *
 * <p>Printings are immutable once stored. Only {@link #withMarketData(CardPrices, Map)}
 * produces a changed copy, for price and legality refreshes.</p>
 */
public record CardPrinting(String printingId,
                           String oracleId,
                           String name,
                           String typeLine,
                           String oracleText,
                           String manaCost,
                           double convertedManaCost,
                           Set<ManaColor> colors,
                           Set<ManaColor> colorIdentity,
                           Set<String> keywords,
                           String setCode,
                           String setName,
                           Rarity rarity,
                           Map<String, String> imageUris,
                           List<CardFace> cardFaces,
                           CardPrices prices,
                           Map<String, Legality> legalities,
                           String power,
                           String toughness) {

    public CardPrinting {
        if (printingId == null || printingId.isBlank()) {
            throw new IllegalArgumentException("printingId is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required for printing " + printingId);
        }
        if (convertedManaCost < 0 || Double.isNaN(convertedManaCost)) {
            throw new IllegalArgumentException("convertedManaCost must be non-negative for printing " + printingId);
        }
        oracleId = oracleId == null || oracleId.isBlank() ? null : oracleId.trim();
        typeLine = typeLine == null ? "" : typeLine;
        oracleText = oracleText == null ? "" : oracleText;
        colors = colors == null ? Set.of() : Set.copyOf(colors);
        colorIdentity = colorIdentity == null ? Set.of() : Set.copyOf(colorIdentity);
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        imageUris = imageUris == null ? Map.of() : Map.copyOf(imageUris);
        cardFaces = cardFaces == null ? List.of() : List.copyOf(cardFaces);
        prices = prices == null ? CardPrices.NONE : prices;
        legalities = legalities == null ? Map.of() : Map.copyOf(legalities);
    }

    public boolean hasOracleId() {
        return oracleId != null;
    }

    /**
     * Rules text across every face, joined the way the feed joins face type lines.
     */
    public String fullOracleText() {
        if (!oracleText.isBlank() || cardFaces.isEmpty()) {
            return oracleText;
        }
        StringBuilder joined = new StringBuilder();
        for (CardFace face : cardFaces) {
            if (face.oracleText() == null || face.oracleText().isBlank()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append("\n//\n");
            }
            joined.append(face.oracleText());
        }
        return joined.toString();
    }

    /**
     * Preferred display image: the printing's own {@code normal} or {@code small}
     * variant, falling back to the front face for multi-face cards.
     */
    public Optional<String> primaryImageUrl() {
        Optional<String> own = pickImage(imageUris);
        if (own.isPresent()) {
            return own;
        }
        return cardFaces.stream()
            .findFirst()
            .flatMap(face -> pickImage(face.imageUris()));
    }

    public Optional<BigDecimal> lowestUsdPrice() {
        BigDecimal usd = prices.usd();
        BigDecimal foil = prices.usdFoil();
        if (usd == null) {
            return Optional.ofNullable(foil);
        }
        if (foil == null) {
            return Optional.of(usd);
        }
        return Optional.of(usd.min(foil));
    }

    public CardPrinting withMarketData(CardPrices refreshedPrices, Map<String, Legality> refreshedLegalities) {
        return new CardPrinting(printingId, oracleId, name, typeLine, oracleText, manaCost, convertedManaCost,
            colors, colorIdentity, keywords, setCode, setName, rarity, imageUris, cardFaces,
            refreshedPrices != null ? refreshedPrices : prices,
            refreshedLegalities != null ? refreshedLegalities : legalities,
            power, toughness);
    }

    private static Optional<String> pickImage(Map<String, String> uris) {
        if (uris == null || uris.isEmpty()) {
            return Optional.empty();
        }
        for (String variant : List.of("normal", "large", "small", "png")) {
            String url = uris.get(variant);
            if (url != null && !url.isBlank()) {
                return Optional.of(url);
            }
        }
        return Optional.empty();
    }
}
