package com.adaptiverisk.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Request payload for setting a risk parameter. Range checks happen in the store so
 * that API and calibration updates share one rule.
 */
@Data
public class RiskParameterUpdateRequest {

    @NotNull
    private BigDecimal value;

    private String reason;
}
