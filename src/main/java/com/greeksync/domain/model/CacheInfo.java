package com.greeksync.domain.model;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Summary of the persisted Greeks cache, shown before a pass and used in diagnostics. */
@Value
@Builder
public class CacheInfo {

    /** Time of the last successful write; staleness of the cache as a whole. */
    Instant lastWrittenAt;

    Duration age;

    /** Records physically present, expired ones included. */
    int recordCount;

    /** Records still within the staleness horizon. */
    int validRecordCount;

    /** Backing file, or "memory" for the in-memory store. */
    String location;

    public double getAgeHours() {
        return age.toMinutes() / 60.0;
    }
}
