package com.greeksync.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.greeksync.domain.enums.GreeksSource;
import com.greeksync.domain.model.GreeksSnapshot;
import com.greeksync.domain.vo.OptionIdentity;
import com.greeksync.exception.GreeksCacheWriteException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greeks cache persisted as a single JSON document (see {@link GreeksCacheDocument}).
 *
 * <p>The file is read in full on first access and rewritten in full on every batch
 * write: the new content goes to a sibling temp file which is then moved over the
 * cache file, so a crash mid-write leaves the previous cache intact.
 *
 * <p>Read failures never propagate. A missing file is an empty cache; an unparseable
 * file is an empty cache plus a warning; an individual record that cannot be parsed,
 * has no delta or capture time, or claims a capture time in the future is dropped
 * with a warning. Write failures raise {@link GreeksCacheWriteException}.
 */
public class JsonFileGreeksCacheStore extends AbstractGreeksCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileGreeksCacheStore.class);

    private final Path cacheFile;
    private final ObjectMapper objectMapper;

    public JsonFileGreeksCacheStore(Path cacheFile, Duration maxAge, ObjectMapper objectMapper, Clock clock) {
        super(maxAge, clock);
        this.cacheFile = cacheFile;
        this.objectMapper = objectMapper
                .copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    protected LoadedRecords load() {
        if (!Files.exists(cacheFile)) {
            log.info("No Greeks cache file at {}, starting empty", cacheFile);
            return LoadedRecords.empty();
        }

        GreeksCacheDocument document;
        try {
            document = objectMapper.readValue(cacheFile.toFile(), GreeksCacheDocument.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Greeks cache file {} is unreadable, ignoring it: {}", cacheFile, e.getMessage());
            return LoadedRecords.empty();
        }
        if (document == null || document.getOptions() == null) {
            log.warn("Greeks cache file {} has no option records, ignoring it", cacheFile);
            return LoadedRecords.empty();
        }

        Instant now = clock.instant();
        Map<OptionIdentity, GreeksSnapshot> records = new LinkedHashMap<>();
        for (Map.Entry<String, GreeksCacheDocument.Entry> entry : document.getOptions().entrySet()) {
            GreeksSnapshot snapshot = toSnapshot(entry.getKey(), entry.getValue(), now);
            if (snapshot != null) {
                records.put(snapshot.getIdentity(), snapshot);
            }
        }

        log.info("Loaded {} cached Greeks records from {} (last written {})", records.size(), cacheFile,
                document.getTimestamp());
        return new LoadedRecords(records, document.getTimestamp());
    }

    @Override
    protected void persist(Map<OptionIdentity, GreeksSnapshot> records, Instant writtenAt) {
        Map<String, GreeksCacheDocument.Entry> options = new TreeMap<>();
        records.forEach((identity, snapshot) -> options.put(identity.toKey(), toEntry(snapshot)));
        GreeksCacheDocument document = new GreeksCacheDocument(writtenAt, options);

        Path tempFile = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tempFile.toFile(), document);
            try {
                Files.move(tempFile, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, cacheFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new GreeksCacheWriteException(cacheFile, e);
        }
    }

    @Override
    protected String location() {
        return cacheFile.toString();
    }

    private GreeksSnapshot toSnapshot(String key, GreeksCacheDocument.Entry entry, Instant now) {
        try {
            OptionIdentity identity = OptionIdentity.fromKey(key);
            if (entry == null || entry.getDelta() == null || entry.getCapturedAt() == null) {
                log.warn("Dropping cached Greeks for {}: missing delta or capture time", key);
                return null;
            }
            if (entry.getCapturedAt().isAfter(now)) {
                log.warn("Dropping cached Greeks for {}: capture time {} is in the future", key,
                        entry.getCapturedAt());
                return null;
            }
            return GreeksSnapshot.builder()
                    .identity(identity)
                    .delta(entry.getDelta())
                    .gamma(entry.getGamma())
                    .theta(entry.getTheta())
                    .vega(entry.getVega())
                    .capturedAt(entry.getCapturedAt())
                    .source(GreeksSource.CACHE)
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("Dropping cached Greeks record with bad key '{}': {}", key, e.getMessage());
            return null;
        }
    }

    private static GreeksCacheDocument.Entry toEntry(GreeksSnapshot snapshot) {
        return GreeksCacheDocument.Entry.builder()
                .delta(snapshot.getDelta())
                .gamma(snapshot.getGamma())
                .theta(snapshot.getTheta())
                .vega(snapshot.getVega())
                .capturedAt(snapshot.getCapturedAt())
                .build();
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not remove temp cache file {}: {}", file, e.getMessage());
        }
    }
}
