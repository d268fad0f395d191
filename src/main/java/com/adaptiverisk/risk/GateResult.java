package com.adaptiverisk.risk;

import com.adaptiverisk.domain.enums.GateDecision;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of {@link AutoExecutionGate#evaluate}.
 *
 * <p>{@code gap} is {@code effectiveThreshold - confidence} and is only meaningful for
 * REQUIRE_APPROVAL, where it is shown to the approver.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GateResult {

    GateDecision decision;
    BigDecimal confidence;
    BigDecimal baseThreshold;
    BigDecimal effectiveThreshold;
    BigDecimal gap;
    String reason;

    @JsonIgnore
    public boolean isAllowed() {
        return decision == GateDecision.ALLOW;
    }

    @JsonIgnore
    public boolean isDenied() {
        return decision == GateDecision.DENY;
    }

    @JsonIgnore
    public boolean requiresApproval() {
        return decision == GateDecision.REQUIRE_APPROVAL;
    }
}
