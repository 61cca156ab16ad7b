package com.eon.credit.lending;

/** Source of collateral prices. Implementations raise {@code PRICE_UNAVAILABLE} rather than return a guess. */
public interface PriceFeed {

    PriceQuote latestPrice(String asset);
}
