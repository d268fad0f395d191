package com.adaptiverisk.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * An open buy lot waiting in a per-symbol FIFO queue.
 *
 * <p>Only the lot matcher mutates {@code remainingQuantity}; a lot is dropped from its
 * queue as soon as the remaining quantity reaches zero.
 */
@Data
@Builder
public class Lot {

    private String symbol;
    private BigDecimal entryPrice;
    private int remainingQuantity;
    private LocalDateTime entryTime;

    /** Confidence of the buy that opened this lot. */
    private BigDecimal confidence;

    private String strategyName;
}
