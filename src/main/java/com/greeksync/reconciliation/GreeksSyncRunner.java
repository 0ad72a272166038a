package com.greeksync.reconciliation;

import com.greeksync.domain.model.GreeksReconciliationResult;
import com.greeksync.exception.BaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Runs one reconciliation pass once the application has started, when
 * {@code greeks.sync.run-on-startup=true}.
 *
 * <p>The pass runs on the startup thread. A failure to fetch positions or to write
 * the cache is rethrown, which fails application startup and gives the invoking
 * shell a non-zero exit status.
 */
@Component
@ConditionalOnProperty(prefix = "greeks.sync", name = "run-on-startup", havingValue = "true")
public class GreeksSyncRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(GreeksSyncRunner.class);

    static final String TRIGGER = "STARTUP";

    private final GreeksReconciliationService greeksReconciliationService;

    public GreeksSyncRunner(GreeksReconciliationService greeksReconciliationService) {
        this.greeksReconciliationService = greeksReconciliationService;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        log.info("Startup: running Greeks reconciliation...");
        try {
            GreeksReconciliationResult result = greeksReconciliationService.reconcile(TRIGGER);
            log.info(
                    "Startup reconciliation finished: {} options, live={}, cache={}, missing={}",
                    result.getOptionCount(),
                    result.getLiveCount(),
                    result.getCacheCount(),
                    result.getMissingCount());
        } catch (BaseException e) {
            log.error(
                    "Startup Greeks reconciliation failed [{}]: {} {}",
                    e.getErrorCode().getCode(),
                    e.getMessage(),
                    e.getDetails());
            throw e;
        } catch (RuntimeException e) {
            log.error("Startup Greeks reconciliation failed: {}", e.getMessage(), e);
            throw e;
        }
    }
}
