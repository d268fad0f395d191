package com.adaptiverisk.api.controller;

import com.adaptiverisk.api.dto.request.TradeRequest;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.adaptiverisk.execution.LiveExecutionService;
import com.adaptiverisk.execution.PendingApproval;
import com.adaptiverisk.execution.TradeDecision;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the live decision cycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/trades -- gate, size and execute a trade decision</li>
 *   <li>GET /api/trades -- live trade stream</li>
 *   <li>GET /api/trades/closed -- FIFO-matched round trips</li>
 *   <li>GET /api/trades/approvals -- requests waiting for approval</li>
 *   <li>POST /api/trades/approvals/{id}/approve -- execute a parked request</li>
 *   <li>POST /api/trades/approvals/{id}/reject -- discard a parked request</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private final LiveExecutionService liveExecutionService;

    public TradeController(LiveExecutionService liveExecutionService) {
        this.liveExecutionService = liveExecutionService;
    }

    @PostMapping
    public ResponseEntity<TradeDecision> submitTrade(@Valid @RequestBody TradeRequest request) {
        return ResponseEntity.ok(liveExecutionService.submit(request));
    }

    @GetMapping
    public ResponseEntity<List<SimulatedTrade>> getTrades() {
        return ResponseEntity.ok(liveExecutionService.trades());
    }

    @GetMapping("/closed")
    public ResponseEntity<List<ClosedTrade>> getClosedTrades() {
        return ResponseEntity.ok(liveExecutionService.closedTrades());
    }

    @GetMapping("/approvals")
    public ResponseEntity<List<PendingApproval>> getPendingApprovals() {
        return ResponseEntity.ok(liveExecutionService.pendingApprovals());
    }

    @PostMapping("/approvals/{approvalId}/approve")
    public ResponseEntity<TradeDecision> approve(@PathVariable String approvalId) {
        return ResponseEntity.ok(liveExecutionService.approve(approvalId));
    }

    @PostMapping("/approvals/{approvalId}/reject")
    public ResponseEntity<TradeDecision> reject(@PathVariable String approvalId) {
        return ResponseEntity.ok(liveExecutionService.reject(approvalId));
    }
}
