package net.findmycard.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * API payload for one printing of a card, shaped after the card-data feed.
 */
public record PrintingDto(String id,
                          @JsonProperty("oracle_id") String oracleId,
                          String name,
                          @JsonProperty("set") String setCode,
                          @JsonProperty("set_name") String setName,
                          String rarity,
                          @JsonProperty("image_uris") Map<String, String> imageUris,
                          @JsonProperty("card_faces") List<FaceDto> cardFaces,
                          Map<String, BigDecimal> prices,
                          String power,
                          String toughness) {

    public record FaceDto(String name,
                          @JsonProperty("mana_cost") String manaCost,
                          @JsonProperty("type_line") String typeLine,
                          @JsonProperty("oracle_text") String oracleText,
                          @JsonProperty("image_uris") Map<String, String> imageUris) {
    }
}
