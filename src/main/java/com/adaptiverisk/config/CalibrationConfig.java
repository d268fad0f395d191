package com.adaptiverisk.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Rules for turning confidence calibration into threshold suggestions.
 *
 * <p>Properties prefix: {@code adaptiverisk.calibration.*}. With defaults: when at least
 * 10 high-confidence trades win more than 70% of the time the threshold drops by 0.05
 * (never below 0.75); when they win less than 50% it rises by 0.05 (never above 0.98).
 */
@Configuration
@ConfigurationProperties(prefix = "adaptiverisk.calibration")
@Getter
@Setter
public class CalibrationConfig {

    /** Lowest confidence counted in the HIGH bucket. */
    private BigDecimal highConfidenceFloor = new BigDecimal("0.8");

    /** Lowest confidence counted in the MEDIUM bucket. */
    private BigDecimal mediumConfidenceFloor = new BigDecimal("0.6");

    private int minSampleSize = 10;
    private BigDecimal strongWinRate = new BigDecimal("0.70");
    private BigDecimal weakWinRate = new BigDecimal("0.50");
    private BigDecimal step = new BigDecimal("0.05");
    private BigDecimal floor = new BigDecimal("0.75");
    private BigDecimal ceiling = new BigDecimal("0.98");

    /** Suggestions closer than this to the current threshold are not worth applying. */
    private BigDecimal minimumChange = new BigDecimal("0.01");
}
