package com.greeksync.reconciliation;

import com.greeksync.domain.enums.Provenance;
import com.greeksync.domain.model.GreeksReconciliationResult;
import com.greeksync.domain.model.Position;
import com.greeksync.domain.model.ReconciledGreeks;
import com.greeksync.event.GreeksReconciliationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Surfaces data-completeness gaps of a reconciliation pass: one warning per option
 * without Greeks, and a degraded-mode warning when no option could be fetched live.
 */
@Component
public class GreeksReconciliationAlertHandler {

    private static final Logger log = LoggerFactory.getLogger(GreeksReconciliationAlertHandler.class);

    @Async("eventExecutor")
    @EventListener
    public void onReconciliation(GreeksReconciliationEvent event) {
        GreeksReconciliationResult result = event.getResult();

        if (result.isDegraded()) {
            log.warn(
                    "Greeks reconciliation ran in degraded mode: no live Greeks for {} options ({} from cache, {} missing). "
                            + "The market may be closed or the feed unreachable.",
                    result.getOptionCount(),
                    result.getCacheCount(),
                    result.getMissingCount());
        }

        for (ReconciledGreeks missing : result.getByProvenance(Provenance.MISSING)) {
            log.warn(
                    "No Greeks available for {} (live fetch {}, no valid cached record)",
                    missing.getIdentity().toDisplayString(),
                    missing.getLiveFailureReason());
        }

        for (Position position : result.getUnidentifiedOptions()) {
            log.warn(
                    "No Greeks available for {}: option contract could not be identified",
                    position.toDisplayString());
        }
    }
}
