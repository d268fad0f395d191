package com.adaptiverisk.domain.enums;

import java.math.BigDecimal;

/**
 * Fixed confidence buckets used by calibration analysis.
 *
 * <p>HIGH is confidence >= 0.8, MEDIUM is [0.6, 0.8), LOW is below 0.6.
 */
public enum ConfidenceBucket {
    HIGH,
    MEDIUM,
    LOW;

    private static final BigDecimal HIGH_FLOOR = new BigDecimal("0.8");
    private static final BigDecimal MEDIUM_FLOOR = new BigDecimal("0.6");

    public static ConfidenceBucket of(BigDecimal confidence) {
        return of(confidence, HIGH_FLOOR, MEDIUM_FLOOR);
    }

    /** Buckets against explicit cut-offs; {@code highFloor} must be above {@code mediumFloor}. */
    public static ConfidenceBucket of(BigDecimal confidence, BigDecimal highFloor, BigDecimal mediumFloor) {
        if (confidence.compareTo(highFloor) >= 0) {
            return HIGH;
        }
        if (confidence.compareTo(mediumFloor) >= 0) {
            return MEDIUM;
        }
        return LOW;
    }
}
