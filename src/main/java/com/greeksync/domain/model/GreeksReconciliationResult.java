package com.greeksync.domain.model;

import com.greeksync.domain.enums.Provenance;
import com.greeksync.domain.vo.OptionIdentity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one reconciliation pass: the authoritative Greeks per held option plus
 * the counters needed to diagnose a partial or failed live fetch.
 *
 * <p>Every identifiable option of the position set appears in {@link #getGreeks()}
 * exactly once, including options with no Greeks available (tagged MISSING). Option
 * positions that cannot be identified are listed in {@link #getUnidentifiedOptions()}
 * and also count as missing.
 *
 * <p>{@code degraded} is set when options were held but none could be fetched live,
 * i.e. the pass ran entirely on cached or missing data.
 */
@Data
@Builder
public class GreeksReconciliationResult {

    private Instant timestamp;
    private String trigger;

    private int positionCount;
    private int optionCount;

    @Builder.Default
    private Map<OptionIdentity, ReconciledGreeks> greeks = new LinkedHashMap<>();

    /**
     * Option positions with a missing or malformed strike, expiry or right, so no Greeks could be requested.
     * Counted in {@code optionCount} and {@code missingCount}.
     */
    @Builder.Default
    private List<Position> unidentifiedOptions = new ArrayList<>();

    private int liveCount;
    private int cacheCount;
    private int missingCount;

    /** Options that needed the retry pass, and how many of those it recovered. */
    private int retriedCount;

    private int recoveredOnRetryCount;

    /** Live snapshots written to the cache in this pass. */
    private int persistedCount;

    private boolean degraded;
    private long durationMs;

    public ReconciledGreeks get(OptionIdentity identity) {
        return greeks.get(identity);
    }

    public List<ReconciledGreeks> getByProvenance(Provenance provenance) {
        return greeks.values().stream()
                .filter(r -> r.getProvenance() == provenance)
                .toList();
    }

    public boolean hasMissing() {
        return missingCount > 0;
    }
}
