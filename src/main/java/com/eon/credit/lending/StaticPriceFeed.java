package com.eon.credit.lending;

import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.UpstreamException;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;

/** Fixed prices from configuration, always reported as fresh. For local runs without an RPC node. */
@RequiredArgsConstructor
public class StaticPriceFeed implements PriceFeed {

    private final Map<String, BigDecimal> prices;
    private final Clock clock;

    @Override
    public PriceQuote latestPrice(String asset) {
        BigDecimal price = prices.get(asset);
        if (price == null) {
            throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE, "No static price configured for " + asset);
        }
        return new PriceQuote(asset, price, clock.instant());
    }
}
