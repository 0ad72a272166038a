package com.greeksync.domain.enums;

/**
 * Where a {@link com.greeksync.domain.model.GreeksSnapshot} came from: the live feed
 * during the current pass, or the persisted cache.
 */
public enum GreeksSource {
    LIVE,
    CACHE
}
