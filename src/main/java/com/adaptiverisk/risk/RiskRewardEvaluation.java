package com.adaptiverisk.risk;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Reward-to-risk assessment of a planned trade. {@code ratio} is
 * {@link Double#POSITIVE_INFINITY} when the stop is at or above the entry.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RiskRewardEvaluation {

    double ratio;
    BigDecimal potentialGain;
    BigDecimal potentialLoss;
    BigDecimal minRequired;
    boolean acceptable;
}
