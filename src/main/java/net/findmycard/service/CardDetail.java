package net.findmycard.service;

import java.util.List;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardPrinting;

/**
 * An identity with every printing that resolves to it, representative first.
 */
public record CardDetail(CardIdentity identity, List<CardPrinting> printings) {

    public CardDetail {
        printings = printings == null ? List.of() : List.copyOf(printings);
    }
}
