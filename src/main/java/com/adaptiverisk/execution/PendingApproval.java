package com.adaptiverisk.execution;

import com.adaptiverisk.api.dto.request.TradeRequest;
import com.adaptiverisk.risk.GateResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** A trade request the gate parked for manual approval. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingApproval {

    String approvalId;
    TradeRequest request;
    GateResult gate;
    LocalDateTime createdAt;
}
