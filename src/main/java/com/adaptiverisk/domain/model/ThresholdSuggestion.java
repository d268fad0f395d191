package com.adaptiverisk.domain.model;

import com.adaptiverisk.domain.enums.LookbackWindow;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Proposed change to the auto-trade confidence threshold derived from calibration data.
 *
 * <p>{@code confidence} is how sure the analyzer is about its own suggestion, not a
 * trade confidence.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ThresholdSuggestion {

    LookbackWindow window;
    BigDecimal currentThreshold;
    BigDecimal suggestedThreshold;
    String reason;
    BigDecimal confidence;
    boolean shouldChange;
}
