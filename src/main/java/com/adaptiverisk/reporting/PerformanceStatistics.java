package com.adaptiverisk.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Portfolio-level statistics for an equity curve plus the trade statistics of its
 * closed round trips.
 *
 * <p>{@code maxDrawdown} is a negative percentage (-12.5 = a 12.5% peak-to-trough fall),
 * 0 for a curve that never dips. {@code sharpeRatio} is annualized with sqrt(252).
 */
@Value
@Builder
public class PerformanceStatistics {

    BigDecimal initialCapital;
    BigDecimal finalValue;
    BigDecimal totalReturn;
    BigDecimal totalReturnPct;
    double sharpeRatio;
    double maxDrawdown;
    int tradingDays;
    TradeStatistics trades;
}
