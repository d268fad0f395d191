package com.adaptiverisk.domain.enums;

import com.adaptiverisk.exception.BusinessException;
import com.adaptiverisk.exception.ErrorCode;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Rolling lookback windows used for live performance and calibration analysis.
 *
 * <p>Each window is evaluated on its own trade subset; nothing is smoothed across windows.
 */
@Getter
@RequiredArgsConstructor
public enum LookbackWindow {
    SHORT("short", 7),
    MEDIUM("medium", 30),
    LONG("long", 90);

    private final String label;
    private final int days;

    /** Inclusive lower bound of the window ending at {@code asOf}. */
    public LocalDateTime startFrom(LocalDateTime asOf) {
        return asOf.minusDays(days);
    }

    /** True when {@code time} falls in [asOf - days, asOf]. */
    public boolean includes(LocalDateTime time, LocalDateTime asOf) {
        return !time.isBefore(startFrom(asOf)) && !time.isAfter(asOf);
    }

    /**
     * Resolves "short"/"medium"/"long" or the enum name, ignoring case.
     *
     * @throws BusinessException with BAD_REQUEST for any other label
     */
    public static LookbackWindow fromLabel(String label) {
        for (LookbackWindow window : values()) {
            if (window.label.equalsIgnoreCase(label) || window.name().equalsIgnoreCase(label)) {
                return window;
            }
        }
        throw new BusinessException(
                ErrorCode.BAD_REQUEST, "Unknown lookback window: " + label, Map.of("window", String.valueOf(label)));
    }
}
