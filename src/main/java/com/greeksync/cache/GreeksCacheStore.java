package com.greeksync.cache;

import com.greeksync.domain.model.CacheInfo;
import com.greeksync.domain.model.GreeksSnapshot;
import com.greeksync.domain.vo.OptionIdentity;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Last known Greeks per option, with a staleness horizon.
 *
 * <p>A record older than the horizon is logically absent: {@link #get} and
 * {@link #loadAll} do not return it, but it stays stored until a newer live snapshot
 * for the same option replaces it. Snapshots returned by the store are tagged
 * {@link com.greeksync.domain.enums.GreeksSource#CACHE}.
 *
 * <p>Single writer: one reconciliation pass at a time owns the store.
 */
public interface GreeksCacheStore {

    /** The cached snapshot if present and within the staleness horizon. */
    Optional<GreeksSnapshot> get(OptionIdentity identity);

    /**
     * Stores a live snapshot, replacing any record for the same option.
     *
     * @throws IllegalArgumentException if the snapshot is captured in the future or has no delta
     * @throws com.greeksync.exception.GreeksCacheWriteException if the store cannot be persisted
     */
    void put(OptionIdentity identity, GreeksSnapshot snapshot);

    /**
     * Stores a batch of live snapshots in one write. A snapshot older than the record
     * it would replace is skipped, so capture times never go backwards.
     *
     * @return number of records written
     * @throws IllegalArgumentException if any snapshot is captured in the future or has no delta;
     *     nothing is written in that case
     * @throws com.greeksync.exception.GreeksCacheWriteException if the store cannot be persisted
     */
    int putAll(Collection<GreeksSnapshot> snapshots);

    /** Every record within the staleness horizon. */
    Map<OptionIdentity, GreeksSnapshot> loadAll();

    /** Summary of the store, or empty if nothing was ever written. */
    Optional<CacheInfo> info();
}
