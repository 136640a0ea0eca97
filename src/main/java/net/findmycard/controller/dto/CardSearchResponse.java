package net.findmycard.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * API payload for paginated card search.
 *
 * @param data current page rows in name order
 * @param hasMore whether another page exists
 * @param totalCards total deduplicated matches
 * @param page one-based page number echoed from the request
 * @param nextPage page to request next, null on the last page
 */
public record CardSearchResponse(List<CardSearchHitDto> data,
                                 @JsonProperty("has_more") boolean hasMore,
                                 @JsonProperty("total_cards") int totalCards,
                                 int page,
                                 @JsonProperty("next_page") Integer nextPage) {
}
