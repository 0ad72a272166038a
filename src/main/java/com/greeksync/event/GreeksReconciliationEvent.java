package com.greeksync.event;

import com.greeksync.domain.model.GreeksReconciliationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed reconciliation pass with the reconciled Greeks
 * and their LIVE/CACHE/MISSING provenance.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>GreeksMetricsService: provenance counters and pass duration</li>
 *   <li>GreeksReconciliationAlertHandler: warns about options without Greeks</li>
 *   <li>downstream leverage/risk consumers</li>
 * </ul>
 */
public class GreeksReconciliationEvent extends ApplicationEvent {

    private final GreeksReconciliationResult result;

    public GreeksReconciliationEvent(Object source, GreeksReconciliationResult result) {
        super(source);
        this.result = result;
    }

    public GreeksReconciliationResult getResult() {
        return result;
    }
}
