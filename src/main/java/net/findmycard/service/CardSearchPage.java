package net.findmycard.service;

import java.util.List;

/**
 * One page of search hits in name order.
 *
 * @param nextPage page number to request next, null on the last page
 */
public record CardSearchPage(List<CardSearchHit> data, boolean hasMore, int totalCards, int page, Integer nextPage) {

    public CardSearchPage {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
