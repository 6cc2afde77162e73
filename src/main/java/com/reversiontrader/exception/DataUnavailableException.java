package com.reversiontrader.exception;

import java.util.Map;

/**
 * No historical bars could be obtained for a requested window.
 * Fatal for a single backtest run; never retried internally.
 */
public class DataUnavailableException extends BaseException {

    public DataUnavailableException(String message) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
    }

    public DataUnavailableException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_UNAVAILABLE, message, details);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DATA_UNAVAILABLE, message, cause);
    }
}
