package com.adaptiverisk.risk;

import com.adaptiverisk.domain.enums.RiskParameterName;
import java.math.BigDecimal;
import java.math.MathContext;
import org.springframework.stereotype.Component;

/**
 * Checks a planned entry/target/stop against {@code min_risk_reward_ratio}.
 */
@Component
public class RiskRewardEvaluator {

    private final RiskParameterStore riskParameterStore;

    public RiskRewardEvaluator(RiskParameterStore riskParameterStore) {
        this.riskParameterStore = riskParameterStore;
    }

    public RiskRewardEvaluation evaluate(BigDecimal entryPrice, BigDecimal targetPrice, BigDecimal stopLoss) {
        BigDecimal gain = targetPrice.subtract(entryPrice);
        BigDecimal loss = entryPrice.subtract(stopLoss);

        double ratio = loss.signum() <= 0
                ? Double.POSITIVE_INFINITY
                : gain.divide(loss, MathContext.DECIMAL64).doubleValue();

        BigDecimal minRatio = riskParameterStore.get(RiskParameterName.MIN_RISK_REWARD_RATIO);
        return RiskRewardEvaluation.builder()
                .ratio(ratio)
                .potentialGain(gain)
                .potentialLoss(loss)
                .minRequired(minRatio)
                .acceptable(ratio >= minRatio.doubleValue())
                .build();
    }
}
