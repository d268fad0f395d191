package com.adaptiverisk.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Tuning for the auto-execution gate. Properties prefix: {@code adaptiverisk.gate.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "adaptiverisk.gate")
@Getter
@Setter
public class ExecutionGateConfig {

    /** Fraction of the daily loss limit at which auto-trading is denied (0.8 = 80%). */
    private BigDecimal circuitBreakerFraction = new BigDecimal("0.8");

    /** Recent win rate below which the threshold is temporarily raised. */
    private BigDecimal lowWinRateFloor = new BigDecimal("0.4");

    /** Amount added to the threshold while the recent win rate is below the floor. */
    private BigDecimal lowWinRatePenalty = new BigDecimal("0.05");

    /** Win rate assumed when there are no recent closed trades. */
    private BigDecimal neutralWinRate = new BigDecimal("0.5");
}
