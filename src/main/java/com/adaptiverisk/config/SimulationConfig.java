package com.adaptiverisk.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Friction model and data location for trade simulation.
 *
 * <p>Properties prefix: {@code adaptiverisk.simulation.*}. Slippage is given in percent
 * (0.1 = 0.1%) and converted to a rate by {@link #getSlippageRate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "adaptiverisk.simulation")
@Getter
@Setter
public class SimulationConfig {

    /** Starting cash for backtests and for the live paper ledger. */
    private BigDecimal initialCapital = new BigDecimal("100000");

    /** Slippage in percent applied against the trader on every fill. */
    private BigDecimal slippagePct = new BigDecimal("0.1");

    /** Flat commission charged per trade. */
    private BigDecimal commission = BigDecimal.ZERO;

    /** Directory holding one {@code SYMBOL.csv} bar file per symbol. */
    private String dataDirectory = "data/bars";

    /** Completed backtest reports kept in memory for lookup. */
    private int retainedReports = 50;

    public BigDecimal getSlippageRate() {
        return slippagePct.movePointLeft(2);
    }
}
