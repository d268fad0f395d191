package com.adaptiverisk.simulator;

import com.adaptiverisk.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * What a {@link SignalStrategy} may see at one step: bars up to and including the
 * current one, never later ones.
 */
@Value
@Builder
public class SignalContext {

    String symbol;
    LocalDateTime timestamp;

    /** Trailing bars, oldest first, ending with the current bar. */
    List<PriceBar> recentBars;

    BigDecimal currentPrice;
    int heldQuantity;
    BigDecimal cash;

    /** Fraction of cash a new position may use. */
    BigDecimal allocationFraction;
}
