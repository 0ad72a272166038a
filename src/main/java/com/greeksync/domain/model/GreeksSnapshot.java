package com.greeksync.domain.model;

import com.greeksync.domain.enums.GreeksSource;
import com.greeksync.domain.vo.OptionIdentity;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Greeks of one option at a point in time, tagged with where they came from.
 *
 * <p>{@code capturedAt} is the time the live update arrived from the feed, never the
 * time the snapshot was written to or read from the cache. Delta is always present;
 * gamma, theta and vega are null when the feed did not report them.
 */
@Value
@Builder(toBuilder = true)
public class GreeksSnapshot {

    OptionIdentity identity;
    BigDecimal delta;
    BigDecimal gamma;
    BigDecimal theta;
    BigDecimal vega;
    Instant capturedAt;
    GreeksSource source;

    public static GreeksSnapshot live(OptionIdentity identity, Greeks greeks, Instant capturedAt) {
        return GreeksSnapshot.builder()
                .identity(identity)
                .delta(greeks.getDelta())
                .gamma(greeks.getGamma())
                .theta(greeks.getTheta())
                .vega(greeks.getVega())
                .capturedAt(capturedAt)
                .source(GreeksSource.LIVE)
                .build();
    }

    /** Same values re-tagged as served from the cache. */
    public GreeksSnapshot asCached() {
        return source == GreeksSource.CACHE ? this : toBuilder().source(GreeksSource.CACHE).build();
    }

    public Duration ageAt(Instant now) {
        return Duration.between(capturedAt, now);
    }

    /** True when gamma, theta, vega and delta carry the same values as {@code other}. */
    public boolean sameValuesAs(GreeksSnapshot other) {
        return other != null
                && compare(delta, other.delta)
                && compare(gamma, other.gamma)
                && compare(theta, other.theta)
                && compare(vega, other.vega);
    }

    private static boolean compare(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
