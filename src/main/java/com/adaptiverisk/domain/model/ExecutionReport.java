package com.adaptiverisk.domain.model;

import com.adaptiverisk.domain.enums.ExecutionStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Fill outcome returned by the brokerage collaborator. */
@Value
@Builder
public class ExecutionReport {

    String brokerOrderId;
    ExecutionStatus status;
    BigDecimal fillPrice;
    int filledQuantity;
    String message;

    public boolean isFilled() {
        return status == ExecutionStatus.FILLED;
    }
}
