package com.reversiontrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable classification of engine failures.
 * {@code fatal} marks errors that must stop the current run instead of being skipped.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONFIGURATION_INVALID("CONFIGURATION_INVALID", true),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE", true),
    EXECUTION_FAILED("EXECUTION_FAILED", false);

    private final String code;
    private final boolean fatal;
}
