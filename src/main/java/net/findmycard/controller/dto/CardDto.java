package net.findmycard.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * API payload for a deduplicated card identity.
 *
 * @param id identity key in wire form (oracle id or {@code derived:<name-slug>:<hash>})
 * @param oracleId oracle id, null for derived identities
 * @param colors color symbols in WUBRG order
 * @param rarities lower-case rarities seen across printings
 * @param legalities format to legality status
 * @param lowestPriceUsd lowest known USD price across printings
 * @param imageUrl image of the representative printing
 */
public record CardDto(String id,
                      @JsonProperty("oracle_id") String oracleId,
                      String name,
                      @JsonProperty("type_line") String typeLine,
                      @JsonProperty("oracle_text") String oracleText,
                      @JsonProperty("mana_cost") String manaCost,
                      double cmc,
                      List<String> colors,
                      @JsonProperty("color_identity") List<String> colorIdentity,
                      List<String> keywords,
                      List<String> rarities,
                      Map<String, String> legalities,
                      @JsonProperty("set_codes") List<String> setCodes,
                      @JsonProperty("lowest_price_usd") BigDecimal lowestPriceUsd,
                      @JsonProperty("image_url") String imageUrl) {
}
