package com.adaptiverisk.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of recent results consumed by the auto-execution gate.
 *
 * <p>{@code dailyPnlPct} is a percentage (-1.7 means down 1.7% today).
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecentPerformance {

    /** Win rate over the short lookback window, in [0, 1]. */
    double winRate;

    BigDecimal dailyPnl;
    BigDecimal dailyPnlPct;
    int recentTrades;

    /** Neutral snapshot: 50% win rate, flat day. */
    public static RecentPerformance neutral() {
        return RecentPerformance.builder()
                .winRate(0.5)
                .dailyPnl(BigDecimal.ZERO)
                .dailyPnlPct(BigDecimal.ZERO)
                .recentTrades(0)
                .build();
    }
}
