package com.adaptiverisk.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Current state of a named risk parameter.
 *
 * <p>{@code previousValue} and {@code reason} describe the most recent change; the full
 * trail lives in {@link RiskParameterHistory}. Parameters are never deleted.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RiskParameter {

    private String name;
    private BigDecimal value;
    private BigDecimal previousValue;
    private String reason;
    private LocalDateTime updatedAt;
}
