package com.greeksync.domain.enums;

/**
 * Provenance tag attached to every option in a reconciliation result.
 *
 * <p>LIVE = fetched from the feed in this pass. CACHE = live fetch failed, a cached
 * snapshot within the staleness horizon was used. MISSING = neither was available;
 * the option is reported without Greeks rather than zero-filled.
 */
public enum Provenance {
    LIVE,
    CACHE,
    MISSING
}
