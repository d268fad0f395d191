package com.adaptiverisk.timeseries;

import java.time.Duration;

/**
 * Bar sizes the historical data provider can serve.
 *
 * <p>Labels match the timeframe strings callers send ("1min", "5min", "15min", "1hour",
 * "1day"). An unknown label falls back to {@link #ONE_DAY}.
 */
public enum BarInterval {
    ONE_MINUTE(Duration.ofMinutes(1), "1min"),
    FIVE_MINUTES(Duration.ofMinutes(5), "5min"),
    FIFTEEN_MINUTES(Duration.ofMinutes(15), "15min"),
    ONE_HOUR(Duration.ofHours(1), "1hour"),
    ONE_DAY(Duration.ofDays(1), "1day");

    private final Duration duration;
    private final String label;

    BarInterval(Duration duration, String label) {
        this.duration = duration;
        this.label = label;
    }

    public Duration getDuration() {
        return duration;
    }

    public String getLabel() {
        return label;
    }

    public static BarInterval fromLabel(String label) {
        if (label == null) {
            return ONE_DAY;
        }
        for (BarInterval interval : values()) {
            if (interval.label.equalsIgnoreCase(label.trim())) {
                return interval;
            }
        }
        return ONE_DAY;
    }
}
