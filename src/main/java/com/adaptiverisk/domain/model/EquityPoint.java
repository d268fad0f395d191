package com.adaptiverisk.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Portfolio equity observed at one simulated time step. */
@Value
@Builder
public class EquityPoint {

    LocalDateTime timestamp;
    BigDecimal equity;
    BigDecimal cash;
    BigDecimal positionsValue;
}
