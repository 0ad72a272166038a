package com.greeksync.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk layout of the Greeks cache file:
 *
 * <pre>
 * {
 *   "timestamp": "2025-01-10T15:30:00Z",
 *   "options": {
 *     "AAPL|20250117|150|C|SMART|USD": {
 *       "delta": 0.55, "gamma": 0.031, "theta": -0.12, "vega": 0.18,
 *       "capturedAt": "2025-01-10T15:29:41Z"
 *     }
 *   }
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GreeksCacheDocument {

    /** Time of the last successful write. */
    private Instant timestamp;

    /** Keyed by {@link com.greeksync.domain.vo.OptionIdentity#toKey()}, sorted for stable diffs. */
    private Map<String, Entry> options = new TreeMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {

        private BigDecimal delta;
        private BigDecimal gamma;
        private BigDecimal theta;
        private BigDecimal vega;
        private Instant capturedAt;
    }
}
