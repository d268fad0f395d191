package com.adaptiverisk.reporting;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Round-trip results for one strategy label within a window. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StrategyPerformance {

    String strategyName;
    int trades;
    int wins;
    int losses;
    BigDecimal totalPnl;
    double winRate;
    BigDecimal avgPnl;
}
