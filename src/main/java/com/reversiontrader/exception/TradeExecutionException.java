package com.reversiontrader.exception;

import java.util.Map;

/**
 * Thrown by an execution sink when an order cannot be filled. The trading
 * cycle records it as a FAILED trade and moves on.
 */
public class TradeExecutionException extends BaseException {

    public TradeExecutionException(String message) {
        super(ErrorCode.EXECUTION_FAILED, message);
    }

    public TradeExecutionException(String message, Map<String, Object> details) {
        super(ErrorCode.EXECUTION_FAILED, message, details);
    }
}
