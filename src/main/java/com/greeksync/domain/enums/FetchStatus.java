package com.greeksync.domain.enums;

public enum FetchStatus {
    SUCCEEDED,
    TIMED_OUT,
    FAILED
}
