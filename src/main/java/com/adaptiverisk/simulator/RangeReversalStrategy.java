package com.adaptiverisk.simulator;

import com.adaptiverisk.domain.enums.TradeSide;
import com.adaptiverisk.domain.model.PriceBar;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Buys a flat symbol whose close is at or below the lowest low of the trailing bars, and
 * sells the whole position once the close reaches the highest high.
 *
 * <p>Buys spend {@code allocationFraction} of current cash; every signal carries
 * confidence 0.7.
 */
@Component
public class RangeReversalStrategy implements SignalStrategy {

    public static final String KEY = "range_reversal";

    static final BigDecimal CONFIDENCE = new BigDecimal("0.7");

    @Override
    public String getKey() {
        return KEY;
    }

    @Override
    public String getDisplayName() {
        return "Range Reversal";
    }

    @Override
    public Optional<TradeSignal> evaluate(SignalContext context) {
        if (context.getRecentBars().isEmpty()) {
            return Optional.empty();
        }
        int window = context.getRecentBars().size();
        BigDecimal price = context.getCurrentPrice();

        if (context.getHeldQuantity() == 0) {
            BigDecimal lowestLow = context.getRecentBars().stream()
                    .map(PriceBar::getLow)
                    .min(BigDecimal::compareTo)
                    .orElseThrow();
            if (price.compareTo(lowestLow) > 0) {
                return Optional.empty();
            }
            int shares = context.getCash()
                    .multiply(context.getAllocationFraction())
                    .divide(price, 0, RoundingMode.FLOOR)
                    .intValue();
            if (shares <= 0) {
                return Optional.empty();
            }
            return Optional.of(TradeSignal.builder()
                    .side(TradeSide.BUY)
                    .quantity(shares)
                    .confidence(CONFIDENCE)
                    .rationale("Close " + price + " at " + window + "-bar low " + lowestLow)
                    .build());
        }

        BigDecimal highestHigh = context.getRecentBars().stream()
                .map(PriceBar::getHigh)
                .max(BigDecimal::compareTo)
                .orElseThrow();
        if (price.compareTo(highestHigh) < 0) {
            return Optional.empty();
        }
        return Optional.of(TradeSignal.builder()
                .side(TradeSide.SELL)
                .quantity(context.getHeldQuantity())
                .confidence(CONFIDENCE)
                .rationale("Close " + price + " at " + window + "-bar high " + highestHigh)
                .build());
    }
}
