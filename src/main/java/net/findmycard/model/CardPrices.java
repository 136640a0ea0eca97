package net.findmycard.model;

import java.math.BigDecimal;

/**
 * Market prices for one printing. Any field may be null when the feed has no quote.
 *
 * @param usd non-foil USD price
 * @param usdFoil foil USD price
 * @param eur non-foil EUR price
 * @param tix MTGO ticket price
 */
public record CardPrices(BigDecimal usd, BigDecimal usdFoil, BigDecimal eur, BigDecimal tix) {

    public static final CardPrices NONE = new CardPrices(null, null, null, null);
}
