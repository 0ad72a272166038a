package com.greeksync.exception;

import java.nio.file.Path;
import java.util.Map;

/**
 * Thrown when the Greeks cache cannot be persisted. Unlike fetch failures and
 * unreadable cache files, this is not absorbed by the reconciliation pass and
 * propagates to the caller.
 */
public class GreeksCacheWriteException extends BaseException {

    public GreeksCacheWriteException(Path cacheFile, Throwable cause) {
        super(
                ErrorCode.CACHE_WRITE_FAILED,
                "Failed to write Greeks cache to " + cacheFile + ": " + cause.getMessage(),
                Map.of("cacheFile", cacheFile.toString()),
                cause);
    }
}
