package com.greeksync.cache;

import com.greeksync.domain.model.GreeksSnapshot;
import com.greeksync.domain.vo.OptionIdentity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Non-durable store with the same staleness rules as the file store. */
public class InMemoryGreeksCacheStore extends AbstractGreeksCacheStore {

    public InMemoryGreeksCacheStore(Duration maxAge, Clock clock) {
        super(maxAge, clock);
    }

    @Override
    protected LoadedRecords load() {
        return LoadedRecords.empty();
    }

    @Override
    protected void persist(Map<OptionIdentity, GreeksSnapshot> records, Instant writtenAt) {
        // held in memory by the base class
    }

    @Override
    protected String location() {
        return "memory";
    }
}
