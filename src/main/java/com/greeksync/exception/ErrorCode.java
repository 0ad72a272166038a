package com.greeksync.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BROKER_ERROR("BROKER_ERROR"),
    CACHE_WRITE_FAILED("CACHE_WRITE_FAILED");

    private final String code;
}
