package net.findmycard.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import net.findmycard.model.CardFace;
import net.findmycard.model.CardPrices;
import net.findmycard.model.CardPrinting;
import net.findmycard.model.Legality;
import net.findmycard.model.ManaColor;
import net.findmycard.model.Rarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static net.findmycard.mapper.ScryfallJsonSupport.decimal;
import static net.findmycard.mapper.ScryfallJsonSupport.number;
import static net.findmycard.mapper.ScryfallJsonSupport.text;
import static net.findmycard.mapper.ScryfallJsonSupport.textArray;
import static net.findmycard.mapper.ScryfallJsonSupport.textObject;

/**
 * Maps Scryfall card objects to {@link CardPrinting}s.
 *
 * <p>Multi-face cards keep their faces in order. Fields Scryfall only reports per face
 * (oracle id on reversible cards, colors and images on transform cards) are lifted
 * from the faces when the card object itself has none.</p>
 */
@Component
public class ScryfallCardMapper {

    private static final Logger log = LoggerFactory.getLogger(ScryfallCardMapper.class);

    /**
     * @return the printing, or empty when the object lacks an id or a name
     */
    public Optional<CardPrinting> toPrinting(JsonNode card) {
        if (card == null || !card.isObject()) {
            return Optional.empty();
        }
        String printingId = text(card, "id");
        String name = text(card, "name");
        if (printingId == null || name == null) {
            log.debug("Skipping Scryfall object without id or name: {}", printingId);
            return Optional.empty();
        }
        List<JsonNode> faceNodes = faceNodes(card);
        List<CardFace> faces = faceNodes.stream().map(ScryfallCardMapper::toFace).toList();

        Set<ManaColor> colors = colors(textArray(card, "colors"));
        if (!card.has("colors")) {
            for (JsonNode face : faceNodes) {
                colors.addAll(colors(textArray(face, "colors")));
            }
        }
        try {
            return Optional.of(new CardPrinting(
                printingId,
                oracleId(card, faceNodes),
                name,
                firstText(card, faceNodes, "type_line"),
                text(card, "oracle_text"),
                firstText(card, faceNodes, "mana_cost"),
                number(card, "cmc"),
                colors,
                colors(textArray(card, "color_identity")),
                new LinkedHashSet<>(textArray(card, "keywords")),
                text(card, "set"),
                text(card, "set_name"),
                Rarity.fromWireValue(text(card, "rarity")).orElse(null),
                textObject(card, "image_uris"),
                faces,
                prices(card),
                legalities(card),
                text(card, "power"),
                text(card, "toughness")));
        } catch (IllegalArgumentException ex) {
            log.warn("Rejected Scryfall card {} ({}): {}", printingId, name, ex.getMessage());
            return Optional.empty();
        }
    }

    public CardPrices prices(JsonNode card) {
        JsonNode prices = card.get("prices");
        if (prices == null || !prices.isObject()) {
            return CardPrices.NONE;
        }
        return new CardPrices(
            decimal(prices, "usd"),
            decimal(prices, "usd_foil"),
            decimal(prices, "eur"),
            decimal(prices, "tix"));
    }

    /**
     * Format legalities keyed by lower-case format name; unknown statuses are dropped.
     */
    public Map<String, Legality> legalities(JsonNode card) {
        Map<String, Legality> legalities = new TreeMap<>();
        textObject(card, "legalities").forEach((format, status) ->
            Legality.fromWireValue(status).ifPresent(legality -> legalities.put(format.toLowerCase(Locale.ROOT), legality)));
        return legalities;
    }

    private static CardFace toFace(JsonNode face) {
        return new CardFace(
            text(face, "name"),
            text(face, "mana_cost"),
            text(face, "type_line"),
            text(face, "oracle_text"),
            textObject(face, "image_uris"));
    }

    private static List<JsonNode> faceNodes(JsonNode card) {
        JsonNode faces = card.get("card_faces");
        if (faces == null || !faces.isArray()) {
            return List.of();
        }
        List<JsonNode> nodes = new ArrayList<>();
        faces.forEach(nodes::add);
        return nodes;
    }

    private static String oracleId(JsonNode card, List<JsonNode> faces) {
        String oracleId = text(card, "oracle_id");
        if (oracleId != null) {
            return oracleId;
        }
        return faces.stream()
            .map(face -> text(face, "oracle_id"))
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);
    }

    private static String firstText(JsonNode card, List<JsonNode> faces, String field) {
        String value = text(card, field);
        if (value != null || faces.isEmpty()) {
            return value;
        }
        List<String> perFace = faces.stream()
            .map(face -> text(face, field))
            .filter(Objects::nonNull)
            .toList();
        return perFace.isEmpty() ? null : String.join(" // ", perFace);
    }

    private static Set<ManaColor> colors(List<String> symbols) {
        Set<ManaColor> colors = EnumSet.noneOf(ManaColor.class);
        for (String symbol : symbols) {
            ManaColor.fromSymbol(symbol).ifPresent(colors::add);
        }
        return colors;
    }
}
