package com.adaptiverisk.exception;

import java.util.Map;

/**
 * A request the engine cannot act on: inconsistent backtest input, an unknown signal
 * strategy, or a market-data collaborator that failed.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
