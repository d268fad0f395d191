package com.adaptiverisk.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A matched round trip produced by FIFO lot matching.
 *
 * <p>One sell can close several lots and one lot can be split across several sells, so
 * a single sell may yield multiple closed trades. Confidence and strategy come from the
 * opening buy.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClosedTrade {

    String symbol;
    int quantity;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal pnl;

    /** (exit - entry) / entry * 100. */
    BigDecimal pnlPct;

    LocalDateTime entryTime;
    LocalDateTime exitTime;
    BigDecimal entryConfidence;
    String strategyName;

    @JsonIgnore
    public boolean isWin() {
        return pnl.signum() > 0;
    }

    @JsonIgnore
    public boolean isLoss() {
        return pnl.signum() < 0;
    }
}
