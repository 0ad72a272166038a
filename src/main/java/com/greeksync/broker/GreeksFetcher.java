package com.greeksync.broker;

import com.greeksync.config.GreeksConfig;
import com.greeksync.domain.model.FetchOutcome;
import com.greeksync.domain.model.FetchReport;
import com.greeksync.domain.model.Greeks;
import com.greeksync.domain.model.GreeksSnapshot;
import com.greeksync.domain.model.GreeksUpdate;
import com.greeksync.domain.vo.OptionIdentity;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Acquires live Greeks for a set of options from the {@link GreeksFeed} within a
 * bounded time budget.
 *
 * <p>Each pass subscribes all requested options, then blocks the calling thread until
 * every option has a terminal outcome or the budget elapses. Feed callbacks complete
 * one {@link CompletableFuture} per option; the first terminal outcome wins and later
 * updates are ignored. Options still pending when the budget runs out are
 * {@code TIMED_OUT}. The pass always unsubscribes every option it requested, whatever
 * the exit path.
 *
 * <p>Terminal outcomes:
 * <ul>
 *   <li>an update whose model or quote Greeks carry a delta -> SUCCEEDED</li>
 *   <li>an upstream rejection -> FAILED with the upstream reason</li>
 *   <li>a feed that throws on subscribe -> FAILED for every option</li>
 * </ul>
 * Updates without a delta are partial ticks and keep the option pending.
 *
 * <p>{@link #fetch} runs the primary pass and then exactly one retry pass for the
 * options left TIMED_OUT or FAILED. The terminal is connection and rate limited, so
 * there is no backoff loop and both failure kinds are retried the same way.
 */
@Service
public class GreeksFetcher {

    private static final Logger log = LoggerFactory.getLogger(GreeksFetcher.class);

    private final GreeksFeed greeksFeed;
    private final GreeksConfig greeksConfig;
    private final Clock clock;

    public GreeksFetcher(GreeksFeed greeksFeed, GreeksConfig greeksConfig, Clock clock) {
        this.greeksFeed = greeksFeed;
        this.greeksConfig = greeksConfig;
        this.clock = clock;
    }

    /**
     * Primary pass with the configured primary wait, then one retry pass with the
     * configured retry wait for whatever did not succeed.
     *
     * @param identities options to fetch; duplicates are ignored
     * @return the final outcome of every requested option
     */
    public FetchReport fetch(Set<OptionIdentity> identities) {
        if (identities.isEmpty()) {
            return FetchReport.empty();
        }

        Duration primaryWait = greeksConfig.getFetch().getPrimaryWait();
        Duration retryWait = greeksConfig.getFetch().getRetryWait();

        log.info("Fetching Greeks for {} options (waiting up to {}s)", identities.size(), primaryWait.toSeconds());
        Map<OptionIdentity, FetchOutcome> outcomes = new LinkedHashMap<>(acquire(identities, primaryWait));

        Set<OptionIdentity> residual = unresolved(outcomes);
        Set<OptionIdentity> resolvedOnRetry = new LinkedHashSet<>();

        if (!residual.isEmpty() && !retryWait.isZero() && !retryWait.isNegative()) {
            log.info(
                    "Greeks missing for {}/{} options after primary pass, retrying once (waiting up to {}s)",
                    residual.size(),
                    identities.size(),
                    retryWait.toSeconds());

            Map<OptionIdentity, FetchOutcome> retryOutcomes = acquire(residual, retryWait);
            for (Map.Entry<OptionIdentity, FetchOutcome> entry : retryOutcomes.entrySet()) {
                outcomes.put(entry.getKey(), entry.getValue());
                if (entry.getValue().isSucceeded()) {
                    resolvedOnRetry.add(entry.getKey());
                }
            }
        } else if (!residual.isEmpty()) {
            log.info("Greeks missing for {} options, retry pass disabled", residual.size());
            residual = Set.of();
        }

        FetchReport report = FetchReport.builder()
                .outcomes(Collections.unmodifiableMap(outcomes))
                .retried(Collections.unmodifiableSet(residual))
                .resolvedOnRetry(Collections.unmodifiableSet(resolvedOnRetry))
                .build();

        log.info(
                "Fetched Greeks for {}/{} options ({} recovered on retry)",
                report.succeededCount(),
                identities.size(),
                resolvedOnRetry.size());
        return report;
    }

    /**
     * Runs a single acquisition pass.
     *
     * @param identities options to request
     * @param budget maximum time to wait for responses
     * @return one outcome per requested option
     */
    public Map<OptionIdentity, FetchOutcome> acquire(Set<OptionIdentity> identities, Duration budget) {
        if (identities.isEmpty()) {
            return Map.of();
        }

        Map<OptionIdentity, CompletableFuture<FetchOutcome>> pending = new LinkedHashMap<>();
        for (OptionIdentity identity : identities) {
            pending.put(identity, new CompletableFuture<>());
        }
        List<OptionIdentity> requested = List.copyOf(pending.keySet());

        try {
            greeksFeed.subscribe(requested, new PassListener(pending));
            log.debug("Subscribed {} options for Greeks", requested.size());

            CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                    .get(Math.max(0, budget.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Greeks budget of {}ms elapsed with responses outstanding", budget.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for Greeks, treating outstanding options as timed out");
        } catch (ExecutionException e) {
            log.error("Unexpected failure while waiting for Greeks", e.getCause());
        } catch (RuntimeException e) {
            log.warn("Greeks feed unavailable: {}", e.getMessage());
            FetchOutcome failed = FetchOutcome.failed("feed unavailable: " + e.getMessage());
            pending.values().forEach(f -> f.complete(failed));
        } finally {
            unsubscribeQuietly(requested);
        }

        Map<OptionIdentity, FetchOutcome> outcomes = new LinkedHashMap<>();
        for (Map.Entry<OptionIdentity, CompletableFuture<FetchOutcome>> entry : pending.entrySet()) {
            CompletableFuture<FetchOutcome> future = entry.getValue();
            // Seals the future so a late update cannot change the outcome after this point.
            future.complete(FetchOutcome.timedOut());
            outcomes.put(entry.getKey(), future.join());
        }
        return outcomes;
    }

    private void unsubscribeQuietly(List<OptionIdentity> requested) {
        try {
            greeksFeed.unsubscribe(requested);
            log.debug("Unsubscribed {} options", requested.size());
        } catch (RuntimeException e) {
            log.warn("Failed to cancel Greeks subscriptions for {} options: {}", requested.size(), e.getMessage());
        }
    }

    private static Set<OptionIdentity> unresolved(Map<OptionIdentity, FetchOutcome> outcomes) {
        Set<OptionIdentity> residual = new LinkedHashSet<>();
        outcomes.forEach((identity, outcome) -> {
            if (!outcome.isSucceeded()) {
                residual.add(identity);
            }
        });
        return residual;
    }

    /** Completes the per-option futures of one pass from feed callbacks. */
    private class PassListener implements GreeksFeedListener {

        private final Map<OptionIdentity, CompletableFuture<FetchOutcome>> pending;

        PassListener(Map<OptionIdentity, CompletableFuture<FetchOutcome>> pending) {
            this.pending = pending;
        }

        @Override
        public void onGreeks(GreeksUpdate update) {
            CompletableFuture<FetchOutcome> future = pending.get(update.getIdentity());
            if (future == null || future.isDone()) {
                return;
            }
            Optional<Greeks> greeks = update.resolve();
            if (greeks.isEmpty()) {
                log.debug("Partial tick without delta for {}", update.getIdentity().toDisplayString());
                return;
            }
            GreeksSnapshot snapshot = GreeksSnapshot.live(update.getIdentity(), greeks.get(), clock.instant());
            if (future.complete(FetchOutcome.succeeded(snapshot))) {
                log.debug(
                        "Greeks received for {}: delta={}",
                        update.getIdentity().toDisplayString(),
                        snapshot.getDelta());
            }
        }

        @Override
        public void onRejected(OptionIdentity identity, String reason) {
            CompletableFuture<FetchOutcome> future = pending.get(identity);
            if (future != null && future.complete(FetchOutcome.failed(reason))) {
                log.debug("Greeks request rejected for {}: {}", identity.toDisplayString(), reason);
            }
        }
    }
}
