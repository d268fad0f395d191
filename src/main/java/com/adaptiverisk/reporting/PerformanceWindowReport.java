package com.adaptiverisk.reporting;

import com.adaptiverisk.calibration.CalibrationReport;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Performance of the round trips closed inside one lookback window.
 *
 * <p>Recomputed on demand from the trade stream; never stored.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PerformanceWindowReport {

    String timeframe;
    LocalDateTime from;
    LocalDateTime to;
    int totalTrades;
    BigDecimal totalPnl;
    double winRate;
    BigDecimal avgWin;
    BigDecimal avgLoss;
    double profitFactor;
    CalibrationReport confidenceCalibration;
    Map<String, StrategyPerformance> strategyPerformance;
}
