package net.findmycard.service;

import net.findmycard.model.CardIdentity;
import net.findmycard.model.CardPrinting;

/**
 * A search result: the deduplicated identity with the printing chosen to represent it.
 */
public record CardSearchHit(CardIdentity identity, CardPrinting representative) {
}
