package com.greeksync.domain.model;

import com.greeksync.domain.enums.FetchStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Terminal result of one fetch attempt for one option. Ephemeral: only the snapshot
 * of a {@link FetchStatus#SUCCEEDED} outcome is ever persisted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchOutcome {

    private static final FetchOutcome TIMED_OUT = new FetchOutcome(FetchStatus.TIMED_OUT, null, "no response within budget");

    FetchStatus status;

    /** Present only for SUCCEEDED. */
    GreeksSnapshot snapshot;

    /** Human-readable failure detail; null for SUCCEEDED. */
    String reason;

    public static FetchOutcome succeeded(GreeksSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("A successful fetch requires a snapshot");
        }
        return new FetchOutcome(FetchStatus.SUCCEEDED, snapshot, null);
    }

    public static FetchOutcome timedOut() {
        return TIMED_OUT;
    }

    public static FetchOutcome failed(String reason) {
        return new FetchOutcome(FetchStatus.FAILED, null, reason);
    }

    public boolean isSucceeded() {
        return status == FetchStatus.SUCCEEDED;
    }
}
