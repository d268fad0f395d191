package com.adaptiverisk.domain.enums;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Risk parameters recognized by the engine, with their documented defaults.
 *
 * <p>With the 0.95 default threshold almost every trade needs approval until calibration
 * lowers it. An unset parameter resolves to its default here.
 */
@Getter
public enum RiskParameterName {

    /** Confidence cutoff for auto-execution. Must stay within [0, 1]. */
    AUTO_TRADE_CONFIDENCE_THRESHOLD("auto_trade_confidence_threshold", new BigDecimal("0.95"), true),

    /** Per-symbol position cap as percent of account value. */
    MAX_POSITION_SIZE_PCT("max_position_size_pct", new BigDecimal("10.0"), false),

    /** Aggregate exposure cap as percent of account value. */
    MAX_PORTFOLIO_EXPOSURE_PCT("max_portfolio_exposure_pct", new BigDecimal("80.0"), false),

    /** Daily loss (percent of equity) that trips the circuit breaker. */
    DAILY_LOSS_LIMIT_PCT("daily_loss_limit_pct", new BigDecimal("2.0"), false),

    /** Minimum acceptable reward-to-risk ratio for a trade. */
    MIN_RISK_REWARD_RATIO("min_risk_reward_ratio", new BigDecimal("2.0"), false),

    /** 0 = conservative, 1 = aggressive. Advisory only. */
    LEARNING_AGGRESSION("learning_aggression", new BigDecimal("0.5"), true);

    private final String key;
    private final BigDecimal defaultValue;

    /** True when the value is a fraction bounded to [0, 1]; otherwise only non-negativity is enforced. */
    private final boolean unitInterval;

    RiskParameterName(String key, BigDecimal defaultValue, boolean unitInterval) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.unitInterval = unitInterval;
    }

    /** Resolves a parameter by its snake_case key or enum name. Returns null if unknown. */
    public static RiskParameterName fromKey(String key) {
        for (RiskParameterName name : values()) {
            if (name.key.equals(key) || name.name().equalsIgnoreCase(key)) {
                return name;
            }
        }
        return null;
    }
}
