package com.adaptiverisk.execution;

import com.adaptiverisk.domain.enums.DecisionStatus;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.adaptiverisk.risk.GateResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one pass through the live decision cycle.
 *
 * <p>{@code trade} is set only for EXECUTED, {@code approvalId} only for PENDING_APPROVAL.
 * {@code gate} is null for decisions made on an already-approved request.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeDecision {

    DecisionStatus status;
    String symbol;
    Integer quantity;
    GateResult gate;
    String approvalId;
    SimulatedTrade trade;
    String message;
}
