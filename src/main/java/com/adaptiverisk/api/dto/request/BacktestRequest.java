package com.adaptiverisk.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Data;

/**
 * Request payload for running a backtest.
 *
 * <p>Symbols and the date range are required. The first symbol's bars drive the step
 * timeline. Initial capital falls back to {@code adaptiverisk.simulation.initial-capital}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestRequest {

    /** Label for the report. */
    private String strategyName = "Custom Strategy";

    private String strategyDescription;

    /** Key of the signal strategy to run. */
    private String signal = "range_reversal";

    @NotEmpty
    private List<String> symbols;

    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;

    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal initialCapital;

    /** Bar interval label: 1min, 5min, 15min, 1hour, 1day. */
    private String timeframe = "1day";

    /** Trailing bars a strategy sees; the first steps are skipped until this many exist. */
    @Min(1)
    private int lookbackBars = 5;

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal allocationFraction = new BigDecimal("0.1");
}
