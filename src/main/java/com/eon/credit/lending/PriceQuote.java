package com.eon.credit.lending;

import java.math.BigDecimal;
import java.time.Instant;

/** USD price of one unit of {@code asset} as last reported by the feed. */
public record PriceQuote(String asset, BigDecimal price, Instant updatedAt) {}
