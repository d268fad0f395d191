package com.adaptiverisk.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Win/loss statistics over a set of closed round trips.
 *
 * <p>{@code profitFactor} is {@link Double#POSITIVE_INFINITY} when there are winners and
 * no losers, and 0 when there are no trades. {@code averageLoss} is negative or zero.
 */
@Value
@Builder
public class TradeStatistics {

    int totalTrades;
    int winningTrades;
    int losingTrades;
    double winRate;
    BigDecimal totalPnl;
    BigDecimal averagePnl;
    BigDecimal grossProfit;
    BigDecimal grossLoss;
    BigDecimal averageWin;
    BigDecimal averageLoss;
    double profitFactor;

    public static TradeStatistics empty() {
        return TradeStatistics.builder()
                .totalTrades(0)
                .winningTrades(0)
                .losingTrades(0)
                .winRate(0.0)
                .totalPnl(BigDecimal.ZERO)
                .averagePnl(BigDecimal.ZERO)
                .grossProfit(BigDecimal.ZERO)
                .grossLoss(BigDecimal.ZERO)
                .averageWin(BigDecimal.ZERO)
                .averageLoss(BigDecimal.ZERO)
                .profitFactor(0.0)
                .build();
    }
}
