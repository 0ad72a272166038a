package com.greeksync.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;

import com.greeksync.broker.GreeksFetcher;
import com.greeksync.config.GreeksConfig;
import com.greeksync.domain.enums.FetchStatus;
import com.greeksync.domain.model.FetchOutcome;
import com.greeksync.domain.model.FetchReport;
import com.greeksync.domain.model.Greeks;
import com.greeksync.domain.vo.OptionIdentity;
import com.greeksync.exception.BrokerException;
import com.greeksync.unit.support.MutableClock;
import com.greeksync.unit.support.ScriptedGreeksFeed;
import com.greeksync.unit.support.TestOptions;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for GreeksFetcher against a scripted feed. Budgets are a few hundred
 * milliseconds so that timeouts are exercised for real.
 */
@DisplayName("GreeksFetcher")
class GreeksFetcherTest {

    private static final Instant NOW = Instant.parse("2025-01-10T15:30:00Z");

    private ScriptedGreeksFeed feed;
    private GreeksConfig greeksConfig;
    private MutableClock clock;
    private GreeksFetcher fetcher;

    @BeforeEach
    void setUp() {
        feed = new ScriptedGreeksFeed();
        greeksConfig = new GreeksConfig();
        greeksConfig.getFetch().setPrimaryWait(Duration.ofMillis(300));
        greeksConfig.getFetch().setRetryWait(Duration.ofMillis(300));
        clock = new MutableClock(NOW);
        fetcher = new GreeksFetcher(feed, greeksConfig, clock);
    }

    @AfterEach
    void tearDown() {
        feed.shutdown();
    }

    private static Set<OptionIdentity> setOf(OptionIdentity... identities) {
        return new LinkedHashSet<>(List.of(identities));
    }

    @Nested
    @DisplayName("Primary pass")
    class PrimaryPass {

        @Test
        @DisplayName("should return SUCCEEDED for every option that responds")
        void allRespond() {
            feed.respond(TestOptions.AAPL_150C, 0.55).respond(TestOptions.TSLA_250C, 0.42);

            FetchReport report = fetcher.fetch(setOf(TestOptions.AAPL_150C, TestOptions.TSLA_250C));

            assertThat(report.succeededCount()).isEqualTo(2);
            FetchOutcome aapl = report.outcomeOf(TestOptions.AAPL_150C);
            assertThat(aapl.getStatus()).isEqualTo(FetchStatus.SUCCEEDED);
            assertThat(aapl.getSnapshot().getDelta()).isEqualByComparingTo("0.55");
            assertThat(aapl.getSnapshot().getGamma()).isEqualByComparingTo("0.031");
            assertThat(aapl.getSnapshot().getCapturedAt()).isEqualTo(NOW);
            assertThat(report.getRetried()).isEmpty();
            assertThat(feed.getSubscribeCalls()).hasSize(1);
        }

        @Test
        @DisplayName("should not wait for the full budget once every option has an outcome")
        void returnsEarly() {
            greeksConfig.getFetch().setPrimaryWait(Duration.ofSeconds(10));
            feed.respond(TestOptions.AAPL_150C, 0.55);

            long start = System.nanoTime();
            fetcher.fetch(setOf(TestOptions.AAPL_150C));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should return TIMED_OUT for an option that answers after the budget")
        void slowOptionTimesOut() {
            greeksConfig.getFetch().setRetryWait(Duration.ZERO);
            feed.respond(TestOptions.AAPL_150C, 0.55).respondAfter(TestOptions.TSLA_250C, 0.42, 1500);

            long start = System.nanoTime();
            FetchReport report = fetcher.fetch(setOf(TestOptions.AAPL_150C, TestOptions.TSLA_250C));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(report.outcomeOf(TestOptions.AAPL_150C).isSucceeded()).isTrue();
            assertThat(report.outcomeOf(TestOptions.TSLA_250C).getStatus()).isEqualTo(FetchStatus.TIMED_OUT);
            assertThat(elapsed).isLessThan(Duration.ofMillis(1500));
        }

        @Test
        @DisplayName("should return FAILED with the upstream reason for a rejected option")
        void rejectedOption() {
            greeksConfig.getFetch().setRetryWait(Duration.ZERO);
            feed.reject(TestOptions.AAPL_140P, "No security definition has been found");

            FetchOutcome outcome = fetcher.fetch(setOf(TestOptions.AAPL_140P)).outcomeOf(TestOptions.AAPL_140P);

            assertThat(outcome.getStatus()).isEqualTo(FetchStatus.FAILED);
            assertThat(outcome.getReason()).isEqualTo("No security definition has been found");
            assertThat(outcome.getSnapshot()).isNull();
        }

        @Test
        @DisplayName("should keep an option pending while updates carry no delta")
        void partialTickIsNotTerminal() {
            greeksConfig.getFetch().setRetryWait(Duration.ZERO);
            Greeks gammaOnly = Greeks.builder().gamma(new BigDecimal("0.02")).build();
            feed.respondWith(TestOptions.AAPL_150C, gammaOnly, null);

            FetchOutcome outcome = fetcher.fetch(setOf(TestOptions.AAPL_150C)).outcomeOf(TestOptions.AAPL_150C);

            assertThat(outcome.getStatus()).isEqualTo(FetchStatus.TIMED_OUT);
        }

        @Test
        @DisplayName("should prefer model Greeks over quote Greeks")
        void modelGreeksPreferred() {
            feed.respondWith(TestOptions.AAPL_150C, ScriptedGreeksFeed.greeks(0.55), ScriptedGreeksFeed.greeks(0.61));

            FetchOutcome outcome = fetcher.fetch(setOf(TestOptions.AAPL_150C)).outcomeOf(TestOptions.AAPL_150C);

            assertThat(outcome.getSnapshot().getDelta()).isEqualByComparingTo("0.55");
        }

        @Test
        @DisplayName("should fall back to quote Greeks when the model set has no delta")
        void quoteGreeksFallback() {
            Greeks modelWithoutDelta = Greeks.builder().vega(new BigDecimal("0.2")).build();
            feed.respondWith(TestOptions.AAPL_150C, modelWithoutDelta, ScriptedGreeksFeed.greeks(0.61));

            FetchOutcome outcome = fetcher.fetch(setOf(TestOptions.AAPL_150C)).outcomeOf(TestOptions.AAPL_150C);

            assertThat(outcome.isSucceeded()).isTrue();
            assertThat(outcome.getSnapshot().getDelta()).isEqualByComparingTo("0.61");
        }

        @Test
        @DisplayName("should not subscribe anything for an empty request")
        void emptyRequest() {
            FetchReport report = fetcher.fetch(Set.of());

            assertThat(report.getOutcomes()).isEmpty();
            assertThat(feed.getSubscribeCalls()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Feed failures")
    class FeedFailures {

        @Test
        @DisplayName("should mark every option FAILED when subscribe throws")
        void subscribeThrows() {
            feed.failSubscribeWith(new BrokerException("Not connected to terminal"));

            FetchReport report = fetcher.fetch(setOf(TestOptions.AAPL_150C, TestOptions.TSLA_250C));

            assertThat(report.getOutcomes().values())
                    .extracting(FetchOutcome::getStatus)
                    .containsOnly(FetchStatus.FAILED);
            assertThat(report.outcomeOf(TestOptions.AAPL_150C).getReason())
                    .isEqualTo("feed unavailable: Not connected to terminal");
            assertThat(report.getRetried()).containsExactly(TestOptions.AAPL_150C, TestOptions.TSLA_250C);
        }

        @Test
        @DisplayName("should unsubscribe every requested option on each pass whatever the exit path")
        void alwaysUnsubscribes() {
            feed.respond(TestOptions.AAPL_150C, 0.55).silent(TestOptions.TSLA_250C);

            fetcher.fetch(setOf(TestOptions.AAPL_150C, TestOptions.TSLA_250C));

            assertThat(feed.getUnsubscribeCalls())
                    .containsExactly(
                            List.of(TestOptions.AAPL_150C, TestOptions.TSLA_250C), List.of(TestOptions.TSLA_250C));
        }

        @Test
        @DisplayName("should unsubscribe even when subscribe throws")
        void unsubscribesAfterSubscribeFailure() {
            greeksConfig.getFetch().setRetryWait(Duration.ZERO);
            feed.failSubscribeWith(new IllegalStateException("socket closed"));

            fetcher.fetch(setOf(TestOptions.AAPL_150C));

            assertThat(feed.getUnsubscribeCalls()).containsExactly(List.of(TestOptions.AAPL_150C));
        }
    }

    @Nested
    @DisplayName("Retry pass")
    class RetryPass {

        @Test
        @DisplayName("should retry only the unresolved options and record recoveries")
        void retryRecovers() {
            feed.respond(TestOptions.AAPL_150C, 0.55)
                    .silent(TestOptions.TSLA_250C)
                    .respond(TestOptions.TSLA_250C, 0.42)
                    .reject(TestOptions.AAPL_140P, "Requested market data is not subscribed")
                    .reject(TestOptions.AAPL_140P, "Requested market data is not subscribed");

            FetchReport report = fetcher.fetch(
                    setOf(TestOptions.AAPL_150C, TestOptions.TSLA_250C, TestOptions.AAPL_140P));

            assertThat(feed.getSubscribeCalls())
                    .containsExactly(
                            List.of(TestOptions.AAPL_150C, TestOptions.TSLA_250C, TestOptions.AAPL_140P),
                            List.of(TestOptions.TSLA_250C, TestOptions.AAPL_140P));
            assertThat(report.getRetried()).containsExactly(TestOptions.TSLA_250C, TestOptions.AAPL_140P);
            assertThat(report.getResolvedOnRetry()).containsExactly(TestOptions.TSLA_250C);
            assertThat(report.outcomeOf(TestOptions.TSLA_250C).getSnapshot().getDelta()).isEqualByComparingTo("0.42");
            assertThat(report.outcomeOf(TestOptions.AAPL_140P).getStatus()).isEqualTo(FetchStatus.FAILED);
        }

        @Test
        @DisplayName("should skip the retry pass when the retry wait is zero")
        void retryDisabled() {
            greeksConfig.getFetch().setRetryWait(Duration.ZERO);
            feed.silent(TestOptions.AAPL_150C).respond(TestOptions.AAPL_150C, 0.55);

            FetchReport report = fetcher.fetch(setOf(TestOptions.AAPL_150C));

            assertThat(feed.getSubscribeCalls()).hasSize(1);
            assertThat(report.getRetried()).isEmpty();
            assertThat(report.outcomeOf(TestOptions.AAPL_150C).getStatus()).isEqualTo(FetchStatus.TIMED_OUT);
        }

        @Test
        @DisplayName("should not retry when the primary pass resolves everything")
        void nothingToRetry() {
            feed.respond(TestOptions.AAPL_150C, 0.55);

            FetchReport report = fetcher.fetch(setOf(TestOptions.AAPL_150C));

            assertThat(feed.getSubscribeCalls()).hasSize(1);
            assertThat(report.getResolvedOnRetry()).isEmpty();
        }
    }

    @Test
    @DisplayName("acquire should return one outcome per requested option")
    void acquireSinglePass() {
        feed.respond(TestOptions.AAPL_150C, 0.55);

        Map<OptionIdentity, FetchOutcome> outcomes =
                fetcher.acquire(setOf(TestOptions.AAPL_150C, TestOptions.AAPL_140P), Duration.ofMillis(200));

        assertThat(outcomes).containsOnlyKeys(TestOptions.AAPL_150C, TestOptions.AAPL_140P);
        assertThat(outcomes.get(TestOptions.AAPL_140P)).isSameAs(FetchOutcome.timedOut());
    }
}
