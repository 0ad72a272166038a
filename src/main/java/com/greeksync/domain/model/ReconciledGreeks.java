package com.greeksync.domain.model;

import com.greeksync.domain.enums.Provenance;
import com.greeksync.domain.vo.OptionIdentity;
import lombok.Builder;
import lombok.Value;

/**
 * The reconciled Greeks of one held option with its provenance tag.
 *
 * <p>For {@link Provenance#MISSING} the snapshot is null; consumers must check
 * {@link #isAvailable()} instead of reading zeros.
 */
@Value
@Builder
public class ReconciledGreeks {

    OptionIdentity identity;
    Provenance provenance;
    GreeksSnapshot snapshot;

    /** Why the live fetch did not succeed (timeout or upstream rejection). Null for LIVE. */
    String liveFailureReason;

    public boolean isAvailable() {
        return provenance != Provenance.MISSING && snapshot != null;
    }
}
