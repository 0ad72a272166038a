package com.greeksync.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One set of option Greeks as delivered by the upstream feed.
 *
 * <p>The terminal computes Greeks itself (model Greeks) and also derives them from
 * bid/ask/last quotes. Either set may arrive partially populated: ticks stream in
 * incrementally, so delta can be present before gamma, theta and vega, or not at all.
 * A set is usable once delta is known; the other sensitivities stay null when the
 * terminal never reports them.
 */
@Value
@Builder
public class Greeks {

    /** Price sensitivity to underlying movement. Range: -1 (deep ITM put) to +1 (deep ITM call). */
    BigDecimal delta;

    /** Rate of change of delta. Highest for ATM options. */
    BigDecimal gamma;

    /** Time decay per day. Negative for long options. */
    BigDecimal theta;

    /** Sensitivity to a 1% change in implied volatility. */
    BigDecimal vega;

    /** Implied volatility as a decimal (e.g., 0.16 = 16%). Informational only; not cached. */
    BigDecimal impliedVolatility;

    public boolean hasDelta() {
        return delta != null;
    }
}
