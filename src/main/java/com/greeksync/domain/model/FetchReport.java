package com.greeksync.domain.model;

import com.greeksync.domain.vo.OptionIdentity;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Final outcome per option after the primary pass and the optional retry pass of
 * {@link com.greeksync.broker.GreeksFetcher#fetch}.
 */
@Value
@Builder
public class FetchReport {

    Map<OptionIdentity, FetchOutcome> outcomes;

    /** Options that went into the retry pass (unresolved after the primary pass). */
    Set<OptionIdentity> retried;

    /** Options that succeeded only in the retry pass. */
    Set<OptionIdentity> resolvedOnRetry;

    public FetchOutcome outcomeOf(OptionIdentity identity) {
        FetchOutcome outcome = outcomes.get(identity);
        return outcome != null ? outcome : FetchOutcome.timedOut();
    }

    public long succeededCount() {
        return outcomes.values().stream().filter(FetchOutcome::isSucceeded).count();
    }

    public static FetchReport empty() {
        return FetchReport.builder()
                .outcomes(Map.of())
                .retried(Set.of())
                .resolvedOnRetry(Set.of())
                .build();
    }
}
