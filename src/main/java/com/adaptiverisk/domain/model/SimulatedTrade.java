package com.adaptiverisk.domain.model;

import com.adaptiverisk.domain.enums.TradeSide;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * An executed trade appended to the trade stream by the trade simulator.
 *
 * <p>{@code fillPrice} already includes slippage. {@code grossValue} is
 * {@code fillPrice * quantity}; {@code netValue} is the cash actually moved:
 * gross plus commission for buys, gross minus commission for sells.
 * {@code cashAfter} is the ledger cash balance right after this trade.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SimulatedTrade {

    String tradeId;
    LocalDateTime timestamp;
    String symbol;
    TradeSide side;
    int quantity;
    BigDecimal fillPrice;
    BigDecimal grossValue;
    BigDecimal commission;
    BigDecimal netValue;

    /** Confidence in [0, 1] attached by whoever proposed the trade. */
    BigDecimal confidence;

    String strategyName;
    String rationale;
    BigDecimal cashAfter;

    @JsonIgnore
    public boolean isBuy() {
        return side == TradeSide.BUY;
    }
}
