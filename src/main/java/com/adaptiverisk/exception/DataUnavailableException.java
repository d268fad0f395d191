package com.adaptiverisk.exception;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Getter;

/**
 * No price bar exists at or before the requested timestamp for a symbol.
 *
 * <p>The trade simulator turns this into a DATA_UNAVAILABLE rejection so that a
 * backtest simply skips the trade and moves on to the next step.
 */
@Getter
public class DataUnavailableException extends BaseException {

    private final String symbol;
    private final LocalDateTime timestamp;

    public DataUnavailableException(String symbol, LocalDateTime timestamp) {
        super(
                ErrorCode.DATA_UNAVAILABLE,
                "No price data for " + symbol + " at or before " + timestamp,
                Map.of("symbol", symbol, "timestamp", String.valueOf(timestamp)));
        this.symbol = symbol;
        this.timestamp = timestamp;
    }
}
