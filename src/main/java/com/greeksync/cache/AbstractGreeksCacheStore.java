package com.greeksync.cache;

import com.greeksync.domain.model.CacheInfo;
import com.greeksync.domain.model.GreeksSnapshot;
import com.greeksync.domain.vo.OptionIdentity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Staleness and write-ordering rules shared by all cache stores. Subclasses only
 * decide how records are loaded and persisted.
 *
 * <p>Records are loaded lazily on first access. A record expires when its age is
 * strictly greater than {@code maxAge}; a record exactly at the horizon is still
 * served in full.
 */
public abstract class AbstractGreeksCacheStore implements GreeksCacheStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractGreeksCacheStore.class);

    protected final Duration maxAge;
    protected final Clock clock;

    private Map<OptionIdentity, GreeksSnapshot> records;
    private Instant lastWrittenAt;

    protected AbstractGreeksCacheStore(Duration maxAge, Clock clock) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be non-negative");
        }
        this.maxAge = maxAge;
        this.clock = clock;
    }

    /** Loads the persisted records. Must not throw; unreadable state is an empty store. */
    protected abstract LoadedRecords load();

    /** Persists the complete record set. Called only with a consistent, validated map. */
    protected abstract void persist(Map<OptionIdentity, GreeksSnapshot> records, Instant writtenAt);

    /** Human-readable location of the backing storage. */
    protected abstract String location();

    @Override
    public synchronized Optional<GreeksSnapshot> get(OptionIdentity identity) {
        GreeksSnapshot snapshot = records().get(identity);
        if (snapshot == null || isExpired(snapshot, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(snapshot);
    }

    @Override
    public void put(OptionIdentity identity, GreeksSnapshot snapshot) {
        if (!identity.equals(snapshot.getIdentity())) {
            throw new IllegalArgumentException("Snapshot identity " + snapshot.getIdentity()
                    + " does not match key " + identity);
        }
        putAll(List.of(snapshot));
    }

    @Override
    public synchronized int putAll(Collection<GreeksSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        snapshots.forEach(snapshot -> validate(snapshot, now));

        Map<OptionIdentity, GreeksSnapshot> updated = new LinkedHashMap<>(records());
        int written = 0;
        for (GreeksSnapshot snapshot : snapshots) {
            GreeksSnapshot existing = updated.get(snapshot.getIdentity());
            if (existing != null && existing.getCapturedAt().isAfter(snapshot.getCapturedAt())) {
                log.debug(
                        "Keeping newer cached Greeks for {} (cached {}, offered {})",
                        snapshot.getIdentity().toDisplayString(),
                        existing.getCapturedAt(),
                        snapshot.getCapturedAt());
                continue;
            }
            updated.put(snapshot.getIdentity(), snapshot.asCached());
            written++;
        }

        if (written == 0) {
            return 0;
        }

        persist(updated, now);
        records = updated;
        lastWrittenAt = now;
        log.info("Cached Greeks for {} options ({} records in {})", written, updated.size(), location());
        return written;
    }

    @Override
    public synchronized Map<OptionIdentity, GreeksSnapshot> loadAll() {
        Instant now = clock.instant();
        Map<OptionIdentity, GreeksSnapshot> valid = new LinkedHashMap<>();
        records().forEach((identity, snapshot) -> {
            if (!isExpired(snapshot, now)) {
                valid.put(identity, snapshot);
            }
        });
        return Collections.unmodifiableMap(valid);
    }

    @Override
    public synchronized Optional<CacheInfo> info() {
        Map<OptionIdentity, GreeksSnapshot> all = records();
        if (lastWrittenAt == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        int valid = (int) all.values().stream().filter(s -> !isExpired(s, now)).count();
        return Optional.of(CacheInfo.builder()
                .lastWrittenAt(lastWrittenAt)
                .age(Duration.between(lastWrittenAt, now))
                .recordCount(all.size())
                .validRecordCount(valid)
                .location(location())
                .build());
    }

    protected boolean isExpired(GreeksSnapshot snapshot, Instant now) {
        return snapshot.ageAt(now).compareTo(maxAge) > 0;
    }

    private Map<OptionIdentity, GreeksSnapshot> records() {
        if (records == null) {
            LoadedRecords loaded = load();
            records = new LinkedHashMap<>(loaded.records());
            lastWrittenAt = loaded.lastWrittenAt();
        }
        return records;
    }

    private static void validate(GreeksSnapshot snapshot, Instant now) {
        if (snapshot.getIdentity() == null) {
            throw new IllegalArgumentException("Snapshot has no option identity");
        }
        if (snapshot.getDelta() == null) {
            throw new IllegalArgumentException("Snapshot for " + snapshot.getIdentity().toDisplayString()
                    + " has no delta");
        }
        if (snapshot.getCapturedAt() == null || snapshot.getCapturedAt().isAfter(now)) {
            throw new IllegalArgumentException("Snapshot for " + snapshot.getIdentity().toDisplayString()
                    + " has capture time " + snapshot.getCapturedAt() + " later than now (" + now + ")");
        }
    }

    /** Records read from backing storage together with the store's last write time. */
    protected record LoadedRecords(Map<OptionIdentity, GreeksSnapshot> records, Instant lastWrittenAt) {

        public static LoadedRecords empty() {
            return new LoadedRecords(Map.of(), null);
        }
    }
}
