package com.greeksync.domain.model;

import com.greeksync.domain.vo.OptionIdentity;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * A push update from the live feed for one subscribed option.
 *
 * <p>Carries the terminal's model Greeks and its quote-derived Greeks, either of
 * which may be null. {@link #resolve()} prefers the model set and falls back to the
 * quote set only when the model set has no delta.
 */
@Value
@Builder
public class GreeksUpdate {

    OptionIdentity identity;
    Greeks modelGreeks;
    Greeks quoteGreeks;

    /** Returns the usable Greeks of this update, or empty if neither set has a delta yet. */
    public Optional<Greeks> resolve() {
        if (modelGreeks != null && modelGreeks.hasDelta()) {
            return Optional.of(modelGreeks);
        }
        if (quoteGreeks != null && quoteGreeks.hasDelta()) {
            return Optional.of(quoteGreeks);
        }
        return Optional.empty();
    }
}
