package com.greeksync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.greeksync.broker.DisconnectedGreeksFeed;
import com.greeksync.broker.GreeksFeed;
import com.greeksync.broker.JsonFilePositionSource;
import com.greeksync.broker.PositionSource;
import com.greeksync.cache.GreeksCacheStore;
import com.greeksync.cache.JsonFileGreeksCacheStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and bean definitions for Greeks acquisition and caching.
 *
 * <p>Binds to the {@code greeks.*} prefix in application.properties. Plain numbers
 * for the fetch waits are seconds, so {@code --wait-greeks=30} on the command line
 * means 30 seconds.
 *
 * <p>The feed and position source defined here are the offline defaults: no live
 * feed (every fetch fails and the pass falls back to the cache) and positions read
 * from an exported JSON file. A brokerage connection module replaces them by
 * declaring its own {@code @Primary} beans.
 */
@Configuration
@ConfigurationProperties(prefix = "greeks")
@Getter
@Setter
public class GreeksConfig {

    private static final Logger log = LoggerFactory.getLogger(GreeksConfig.class);

    private Fetch fetch = new Fetch();

    private Cache cache = new Cache();

    private Positions positions = new Positions();

    private Sync sync = new Sync();

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GreeksCacheStore greeksCacheStore(ObjectMapper objectMapper, Clock clock) {
        log.info("Greeks cache: file={}, maxAge={}", cache.getFile(), cache.getMaxAge());
        return new JsonFileGreeksCacheStore(cache.getFile(), cache.getMaxAge(), objectMapper, clock);
    }

    @Bean
    public GreeksFeed greeksFeed() {
        return new DisconnectedGreeksFeed();
    }

    @Bean
    public PositionSource positionSource(ObjectMapper objectMapper) {
        return new JsonFilePositionSource(positions.getFile(), objectMapper);
    }

    @Getter
    @Setter
    public static class Fetch {

        /** Time budget of the primary fetch pass. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration primaryWait = Duration.ofSeconds(15);

        /** Time budget of the single retry pass. Zero disables the retry. */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration retryWait = Duration.ofSeconds(20);
    }

    @Getter
    @Setter
    public static class Cache {

        /** JSON file holding the last known Greeks per option. */
        private Path file = Path.of("data", "greeks_cache.json");

        /** Staleness horizon: cached Greeks older than this are ignored. */
        @DurationUnit(ChronoUnit.HOURS)
        private Duration maxAge = Duration.ofHours(48);
    }

    @Getter
    @Setter
    public static class Positions {

        /** Exported positions used by the offline position source. */
        private Path file = Path.of("data", "positions.json");
    }

    @Getter
    @Setter
    public static class Sync {

        /** Run one reconciliation pass once the application has started. */
        private boolean runOnStartup = false;
    }
}
