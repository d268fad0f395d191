package com.adaptiverisk.risk;

import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.model.PositionSizingContext;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Confidence-scaled share quantity bounded by the position and exposure caps.
 *
 * <pre>
 *   target    = max_position_size_pct / 100 * confidence
 *   available = max_portfolio_exposure_pct / 100 - current exposure
 *   shares    = floor(account * min(target, available) / price), 0 if available &lt;= 0
 * </pre>
 *
 * <p>The new trade is sized on its own: an existing position in the same symbol is not
 * netted against the per-symbol cap, so repeated buys can accumulate past it. Only the
 * aggregate exposure cap sees existing holdings (through the exposure fraction).
 *
 * <p>No side effects; the only read is the two caps from {@link RiskParameterStore}.
 */
@Component
public class PositionSizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskParameterStore riskParameterStore;

    public PositionSizer(RiskParameterStore riskParameterStore) {
        this.riskParameterStore = riskParameterStore;
    }

    public int size(PositionSizingContext context) {
        return size(
                context.getSymbol(),
                context.getConfidence(),
                context.getAccountValue(),
                context.getPrice(),
                context.getCurrentExposureFraction());
    }

    /**
     * @param confidence              trade confidence in [0, 1]
     * @param currentExposureFraction share of account already invested, as a fraction
     * @return whole shares to buy, never negative
     */
    public int size(
            String symbol,
            BigDecimal confidence,
            BigDecimal accountValue,
            BigDecimal price,
            BigDecimal currentExposureFraction) {
        if (price == null || price.signum() <= 0 || accountValue == null || accountValue.signum() <= 0) {
            return 0;
        }

        BigDecimal maxPosition =
                riskParameterStore.get(RiskParameterName.MAX_POSITION_SIZE_PCT).divide(HUNDRED);
        BigDecimal maxExposure =
                riskParameterStore.get(RiskParameterName.MAX_PORTFOLIO_EXPOSURE_PCT).divide(HUNDRED);

        BigDecimal target = maxPosition.multiply(confidence);
        BigDecimal exposure = currentExposureFraction != null ? currentExposureFraction : BigDecimal.ZERO;
        BigDecimal available = maxExposure.subtract(exposure);
        if (available.signum() <= 0) {
            return 0;
        }

        BigDecimal fraction = target.min(available);
        BigDecimal shares = accountValue.multiply(fraction).divide(price, 0, RoundingMode.FLOOR);
        return Math.max(0, shares.min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValue());
    }
}
