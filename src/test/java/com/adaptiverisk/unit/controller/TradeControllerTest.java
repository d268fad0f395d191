package com.adaptiverisk.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.adaptiverisk.api.controller.TradeController;
import com.adaptiverisk.api.dto.request.TradeRequest;
import com.adaptiverisk.config.ApiResponseAdvice;
import com.adaptiverisk.domain.enums.DecisionStatus;
import com.adaptiverisk.domain.enums.TradeSide;
import com.adaptiverisk.exception.GlobalExceptionHandler;
import com.adaptiverisk.exception.ResourceNotFoundException;
import com.adaptiverisk.execution.LiveExecutionService;
import com.adaptiverisk.execution.TradeDecision;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the TradeController.
 */
@ExtendWith(MockitoExtension.class)
class TradeControllerTest {

    private MockMvc mockMvc;

    @Mock
    private LiveExecutionService liveExecutionService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TradeController(liveExecutionService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/trades parses the snake_case body and returns the decision")
    void submitTrade() throws Exception {
        when(liveExecutionService.submit(any()))
                .thenReturn(TradeDecision.builder()
                        .status(DecisionStatus.PENDING_APPROVAL)
                        .symbol("AAPL")
                        .approvalId("appr-1")
                        .message("Confidence is 0.05 below the auto-trade threshold")
                        .build());

        mockMvc.perform(post("/api/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\": \"AAPL\", \"side\": \"buy\", \"price\": 187.5,"
                                + " \"confidence\": 0.9, \"strategy_name\": \"Momentum\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PENDING_APPROVAL"))
                .andExpect(jsonPath("$.data.approval_id").value("appr-1"))
                .andExpect(jsonPath("$.data.trade").doesNotExist());

        verify(liveExecutionService)
                .submit(argThat((TradeRequest r) -> r.getSide() == TradeSide.BUY
                        && "Momentum".equals(r.getStrategyName())
                        && r.getQuantity() == null));
    }

    @Test
    @DisplayName("POST /api/trades rejects confidence above 1")
    void confidenceOutOfRange() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\": \"AAPL\", \"side\": \"BUY\", \"price\": 100, \"confidence\": 1.2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.confidence").exists());

        verify(liveExecutionService, never()).submit(any());
    }

    @Test
    @DisplayName("POST /api/trades reports an unknown side by its JSON field")
    void unknownSide() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\": \"AAPL\", \"side\": \"hold\", \"price\": 100, \"confidence\": 0.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.details.field").value("side"));

        verify(liveExecutionService, never()).submit(any());
    }

    @Test
    @DisplayName("POST /api/trades rejects a missing price")
    void missingPrice() throws Exception {
        mockMvc.perform(post("/api/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\": \"AAPL\", \"side\": \"SELL\", \"confidence\": 0.5}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/trades/approvals/{id}/approve executes the parked trade")
    void approve() throws Exception {
        when(liveExecutionService.approve("appr-1"))
                .thenReturn(TradeDecision.builder()
                        .status(DecisionStatus.EXECUTED)
                        .symbol("AAPL")
                        .quantity(10)
                        .message("Filled by PAPER-1")
                        .build());

        mockMvc.perform(post("/api/trades/approvals/appr-1/approve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("EXECUTED"))
                .andExpect(jsonPath("$.data.quantity").value(10));
    }

    @Test
    @DisplayName("Unknown approval id returns 404")
    void unknownApproval() throws Exception {
        when(liveExecutionService.reject("missing")).thenThrow(new ResourceNotFoundException("Approval", "missing"));

        mockMvc.perform(post("/api/trades/approvals/missing/reject"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/trades/approvals lists parked requests")
    void listApprovals() throws Exception {
        when(liveExecutionService.pendingApprovals()).thenReturn(List.of());

        mockMvc.perform(get("/api/trades/approvals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray())
                .andExpect(jsonPath("$.data").isEmpty());
    }
}
