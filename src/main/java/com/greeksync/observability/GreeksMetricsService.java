package com.greeksync.observability;

import com.greeksync.domain.model.GreeksReconciliationResult;
import com.greeksync.event.GreeksReconciliationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for Greeks reconciliation:
 * <ul>
 *   <li><b>greeks.reconciliation.live</b> (counter): options reconciled from the live feed</li>
 *   <li><b>greeks.reconciliation.cache</b> (counter): options served from the cache</li>
 *   <li><b>greeks.reconciliation.missing</b> (counter): options with no Greeks at all</li>
 *   <li><b>greeks.reconciliation.retry.recovered</b> (counter): options recovered by the retry pass</li>
 *   <li><b>greeks.reconciliation.degraded</b> (counter): passes without a single live result</li>
 *   <li><b>greeks.reconciliation.duration</b> (timer): wall time of a pass</li>
 * </ul>
 */
@Service
public class GreeksMetricsService {

    private final Counter liveCounter;
    private final Counter cacheCounter;
    private final Counter missingCounter;
    private final Counter retryRecoveredCounter;
    private final Counter degradedCounter;
    private final Timer durationTimer;

    public GreeksMetricsService(MeterRegistry meterRegistry) {
        this.liveCounter = Counter.builder("greeks.reconciliation.live")
                .description("Options reconciled from the live feed")
                .register(meterRegistry);

        this.cacheCounter = Counter.builder("greeks.reconciliation.cache")
                .description("Options reconciled from cached Greeks")
                .register(meterRegistry);

        this.missingCounter = Counter.builder("greeks.reconciliation.missing")
                .description("Options with neither live nor cached Greeks")
                .register(meterRegistry);

        this.retryRecoveredCounter = Counter.builder("greeks.reconciliation.retry.recovered")
                .description("Options whose Greeks arrived only in the retry pass")
                .register(meterRegistry);

        this.degradedCounter = Counter.builder("greeks.reconciliation.degraded")
                .description("Reconciliation passes without any live Greeks")
                .register(meterRegistry);

        this.durationTimer = Timer.builder("greeks.reconciliation.duration")
                .description("Wall time of a reconciliation pass including fetch waits")
                .maximumExpectedValue(Duration.ofMinutes(2))
                .register(meterRegistry);
    }

    @EventListener
    public void onReconciliation(GreeksReconciliationEvent event) {
        GreeksReconciliationResult result = event.getResult();
        liveCounter.increment(result.getLiveCount());
        cacheCounter.increment(result.getCacheCount());
        missingCounter.increment(result.getMissingCount());
        retryRecoveredCounter.increment(result.getRecoveredOnRetryCount());
        if (result.isDegraded()) {
            degradedCounter.increment();
        }
        durationTimer.record(result.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}
