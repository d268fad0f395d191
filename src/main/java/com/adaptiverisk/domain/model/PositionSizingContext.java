package com.adaptiverisk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Input for {@link com.adaptiverisk.risk.PositionSizer}.
 *
 * <p>{@code currentExposureFraction} is the share of account value already committed to
 * open positions, as a fraction (0.35 = 35%), across all symbols.
 */
@Data
@Builder
public class PositionSizingContext {

    private String symbol;

    /** Trade confidence in [0, 1]. */
    private BigDecimal confidence;

    private BigDecimal accountValue;
    private BigDecimal price;
    private BigDecimal currentExposureFraction;
}
