package com.eon.credit.lending;

import com.eon.credit.config.CreditProperties;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.UpstreamException;
import com.eon.credit.error.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/** Gatekeeper in front of the price feed: rejects unsupported assets, missing answers and stale quotes. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceOracle {

    private final PriceFeed feed;
    private final CreditProperties properties;
    private final Clock clock;

    public PriceQuote freshPrice(String asset) {
        if (!properties.getPool().getCollateralAssets().contains(asset)) {
            throw new ValidationException(CreditErrorCode.UNSUPPORTED_ASSET, asset + " is not accepted as collateral");
        }
        PriceQuote quote = feed.latestPrice(asset);
        if (quote == null || quote.price() == null || quote.price().signum() <= 0 || quote.updatedAt() == null) {
            log.warn("Price feed returned no usable answer for {}", asset);
            throw new UpstreamException(CreditErrorCode.PRICE_UNAVAILABLE, "No price available for " + asset);
        }
        Instant oldestAccepted = clock.instant().minus(properties.getPriceFeed().getMaxStaleness());
        if (quote.updatedAt().isBefore(oldestAccepted)) {
            log.warn("Stale price for {}: updated {}", asset, quote.updatedAt());
            throw new UpstreamException(CreditErrorCode.STALE_PRICE,
                    "Price of " + asset + " last updated " + quote.updatedAt());
        }
        return quote;
    }
}
