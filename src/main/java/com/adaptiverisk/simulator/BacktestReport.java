package com.adaptiverisk.simulator;

import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one backtest run. Field names are part of the reporting contract and are
 * serialized in snake_case.
 *
 * <p>{@code maxDrawdown} is a negative percentage. {@code profitFactor} may be infinite
 * (serialized as the string "Infinity").
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestReport {

    String backtestId;
    String strategyName;
    String strategyDescription;
    List<String> symbols;
    LocalDate startDate;
    LocalDate endDate;

    BigDecimal initialCapital;
    BigDecimal finalValue;
    BigDecimal totalReturn;
    BigDecimal totalReturnPct;
    double sharpeRatio;
    double maxDrawdown;
    double winRate;
    double profitFactor;
    int totalTrades;
    BigDecimal avgTradePnl;
    int tradingDays;

    List<EquityCurveEntry> equityCurve;
    List<SimulatedTrade> tradeHistory;
    List<ClosedTrade> closedTrades;

    LocalDateTime createdAt;
}
