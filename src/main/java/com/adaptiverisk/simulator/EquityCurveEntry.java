package com.adaptiverisk.simulator;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Value;

/** One {@code {date, equity}} entry of a backtest report's equity curve. */
@Value
public class EquityCurveEntry {

    LocalDate date;
    BigDecimal equity;
}
