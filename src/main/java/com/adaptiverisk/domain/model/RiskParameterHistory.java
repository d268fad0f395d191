package com.adaptiverisk.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Audit record for one risk parameter change.
 *
 * <p>Written on every accepted update, including the initial write of a default.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RiskParameterHistory {

    private Long id;
    private String name;

    /** Null for the first recorded value. */
    private BigDecimal oldValue;

    private BigDecimal newValue;

    /** Who made the change ("API", "CALIBRATION", "SYSTEM"). */
    private String changedBy;

    private String reason;
    private LocalDateTime timestamp;
}
