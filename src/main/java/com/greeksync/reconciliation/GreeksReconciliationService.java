package com.greeksync.reconciliation;

import com.greeksync.broker.GreeksFetcher;
import com.greeksync.broker.PositionSource;
import com.greeksync.cache.GreeksCacheStore;
import com.greeksync.domain.enums.Provenance;
import com.greeksync.domain.model.CacheInfo;
import com.greeksync.domain.model.FetchOutcome;
import com.greeksync.domain.model.FetchReport;
import com.greeksync.domain.model.GreeksReconciliationResult;
import com.greeksync.domain.model.GreeksSnapshot;
import com.greeksync.domain.model.Position;
import com.greeksync.domain.model.ReconciledGreeks;
import com.greeksync.domain.vo.OptionIdentity;
import com.greeksync.event.GreeksReconciliationEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Produces one authoritative set of Greeks for the options currently held, using
 * live data where the feed delivers it and cached data otherwise.
 *
 * <p>Per option, in order:
 * <ul>
 *   <li>live fetch succeeded (primary or retry pass) -> LIVE, and queued for the cache</li>
 *   <li>live fetch timed out or failed, cached record within the staleness horizon -> CACHE</li>
 *   <li>neither -> MISSING, reported without values</li>
 * </ul>
 *
 * <p>All live snapshots of a pass are written to the cache in one batch at the end,
 * whether or not other options fell back to the cache. Fetch failures, a dead feed
 * and an unreadable cache file only degrade the result; a failure to write the cache
 * propagates to the caller.
 *
 * <p>Passes are serialized: the cache store has a single writer.
 */
@Service
public class GreeksReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(GreeksReconciliationService.class);

    private final PositionSource positionSource;
    private final GreeksFetcher greeksFetcher;
    private final GreeksCacheStore greeksCacheStore;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public GreeksReconciliationService(
            PositionSource positionSource,
            GreeksFetcher greeksFetcher,
            GreeksCacheStore greeksCacheStore,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.positionSource = positionSource;
        this.greeksFetcher = greeksFetcher;
        this.greeksCacheStore = greeksCacheStore;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Reconciles the positions currently reported by the position source.
     *
     * @throws com.greeksync.exception.BrokerException if positions cannot be retrieved
     * @throws com.greeksync.exception.GreeksCacheWriteException if live Greeks cannot be cached
     */
    public GreeksReconciliationResult reconcile(String trigger) {
        return reconcile(positionSource.fetchPositions(), trigger);
    }

    /**
     * Reconciles the given positions. Non-option positions are ignored.
     *
     * @throws com.greeksync.exception.GreeksCacheWriteException if live Greeks cannot be cached
     */
    public synchronized GreeksReconciliationResult reconcile(List<Position> positions, String trigger) {
        long startTime = System.currentTimeMillis();
        List<Position> unidentified = new ArrayList<>();
        Set<OptionIdentity> identities = optionIdentities(positions, unidentified);
        int optionCount = identities.size() + unidentified.size();
        log.info(
                "Greeks reconciliation started: trigger={}, positions={}, options={}",
                trigger,
                positions.size(),
                optionCount);

        greeksCacheStore
                .info()
                .ifPresent(info -> log.info(
                        "Greeks cache available: {} valid of {} records, age {} hours",
                        info.getValidRecordCount(),
                        info.getRecordCount(),
                        String.format("%.1f", info.getAgeHours())));

        Map<OptionIdentity, GreeksSnapshot> cached =
                identities.isEmpty() ? Map.of() : greeksCacheStore.loadAll();
        FetchReport fetchReport = greeksFetcher.fetch(identities);
        Instant fetchedAt = clock.instant();

        Map<OptionIdentity, ReconciledGreeks> reconciled = new LinkedHashMap<>();
        List<GreeksSnapshot> liveSnapshots = new ArrayList<>();
        int live = 0;
        int fromCache = 0;
        int missing = 0;

        for (OptionIdentity identity : identities) {
            FetchOutcome outcome = fetchReport.outcomeOf(identity);

            if (outcome.isSucceeded()) {
                GreeksSnapshot snapshot = notAfter(outcome.getSnapshot(), fetchedAt);
                reconciled.put(identity, ReconciledGreeks.builder()
                        .identity(identity)
                        .provenance(Provenance.LIVE)
                        .snapshot(snapshot)
                        .build());
                liveSnapshots.add(snapshot);
                live++;
                continue;
            }

            String failureReason = describe(outcome);
            Optional<GreeksSnapshot> fallback = Optional.ofNullable(cached.get(identity));
            if (fallback.isPresent()) {
                reconciled.put(identity, ReconciledGreeks.builder()
                        .identity(identity)
                        .provenance(Provenance.CACHE)
                        .snapshot(fallback.get())
                        .liveFailureReason(failureReason)
                        .build());
                fromCache++;
            } else {
                reconciled.put(identity, ReconciledGreeks.builder()
                        .identity(identity)
                        .provenance(Provenance.MISSING)
                        .liveFailureReason(failureReason)
                        .build());
                missing++;
            }
        }

        int persisted = liveSnapshots.isEmpty() ? 0 : greeksCacheStore.putAll(liveSnapshots);

        GreeksReconciliationResult result = GreeksReconciliationResult.builder()
                .timestamp(clock.instant())
                .trigger(trigger)
                .positionCount(positions.size())
                .optionCount(optionCount)
                .greeks(reconciled)
                .unidentifiedOptions(List.copyOf(unidentified))
                .liveCount(live)
                .cacheCount(fromCache)
                .missingCount(missing + unidentified.size())
                .retriedCount(fetchReport.getRetried().size())
                .recoveredOnRetryCount(fetchReport.getResolvedOnRetry().size())
                .persistedCount(persisted)
                .degraded(optionCount > 0 && live == 0)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();

        logSummary(result);
        applicationEventPublisher.publishEvent(new GreeksReconciliationEvent(this, result));
        return result;
    }

    /** Cache summary for diagnostics; empty when nothing was ever cached. */
    public Optional<CacheInfo> cacheInfo() {
        return greeksCacheStore.info();
    }

    /** Distinct option identities; option positions that cannot be identified are added to {@code unidentified}. */
    private static Set<OptionIdentity> optionIdentities(List<Position> positions, List<Position> unidentified) {
        Set<OptionIdentity> identities = new LinkedHashSet<>();
        for (Position position : positions) {
            if (!position.isOption()) {
                continue;
            }
            try {
                identities.add(OptionIdentity.fromPosition(position));
            } catch (IllegalArgumentException e) {
                log.warn("Cannot identify option position {}: {}", position.toDisplayString(), e.getMessage());
                unidentified.add(position);
            }
        }
        return identities;
    }

    /**
     * Caps the capture time at {@code now}. The feed stamps updates on its own thread,
     * and a wall clock stepped back in between would otherwise date them in the future.
     */
    private static GreeksSnapshot notAfter(GreeksSnapshot snapshot, Instant now) {
        if (!snapshot.getCapturedAt().isAfter(now)) {
            return snapshot;
        }
        log.warn(
                "Capture time {} of {} is ahead of the clock, capping it at {}",
                snapshot.getCapturedAt(),
                snapshot.getIdentity().toDisplayString(),
                now);
        return snapshot.toBuilder().capturedAt(now).build();
    }

    private static String describe(FetchOutcome outcome) {
        return switch (outcome.getStatus()) {
            case TIMED_OUT -> "timed out";
            case FAILED -> "failed: " + outcome.getReason();
            case SUCCEEDED -> null;
        };
    }

    private void logSummary(GreeksReconciliationResult result) {
        Instant now = result.getTimestamp();
        for (ReconciledGreeks greeks : result.getGreeks().values()) {
            String label = greeks.getIdentity().toDisplayString();
            switch (greeks.getProvenance()) {
                case LIVE -> log.info("  {} -> LIVE delta={}", label, greeks.getSnapshot().getDelta());
                case CACHE -> log.info(
                        "  {} -> CACHE delta={} (captured {} hours ago; live fetch {})",
                        label,
                        greeks.getSnapshot().getDelta(),
                        String.format("%.1f", greeks.getSnapshot().ageAt(now).toMinutes() / 60.0),
                        greeks.getLiveFailureReason());
                case MISSING -> log.info("  {} -> MISSING (live fetch {})", label, greeks.getLiveFailureReason());
            }
        }
        for (Position position : result.getUnidentifiedOptions()) {
            log.info("  {} -> MISSING (option contract not identifiable)", position.toDisplayString());
        }

        if (result.isDegraded()) {
            log.warn(
                    "Greeks reconciliation complete in degraded mode: live=0, cache={}, missing={}, duration={}ms",
                    result.getCacheCount(),
                    result.getMissingCount(),
                    result.getDurationMs());
        } else {
            log.info(
                    "Greeks reconciliation complete: live={}, cache={}, missing={}, cached={}, duration={}ms",
                    result.getLiveCount(),
                    result.getCacheCount(),
                    result.getMissingCount(),
                    result.getPersistedCount(),
                    result.getDurationMs());
        }
    }
}
