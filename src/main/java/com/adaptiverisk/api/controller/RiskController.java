package com.adaptiverisk.api.controller;

import com.adaptiverisk.api.dto.request.RiskParameterUpdateRequest;
import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.model.RiskParameter;
import com.adaptiverisk.domain.model.RiskParameterHistory;
import com.adaptiverisk.risk.RiskParameterStore;
import com.adaptiverisk.risk.RiskRewardEvaluation;
import com.adaptiverisk.risk.RiskRewardEvaluator;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk parameters and trade-quality checks.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/parameters -- every recognized parameter, defaults included</li>
 *   <li>GET /api/risk/parameters/{name} -- one parameter with its last change</li>
 *   <li>PUT /api/risk/parameters/{name} -- set a value with a reason (audited)</li>
 *   <li>GET /api/risk/parameters/{name}/history -- audit trail, newest first</li>
 *   <li>GET /api/risk/history?from=&amp;to= -- audit trail of every parameter in a time range</li>
 *   <li>GET /api/risk/risk-reward -- reward-to-risk check for entry/target/stop</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskParameterStore riskParameterStore;
    private final RiskRewardEvaluator riskRewardEvaluator;

    public RiskController(RiskParameterStore riskParameterStore, RiskRewardEvaluator riskRewardEvaluator) {
        this.riskParameterStore = riskParameterStore;
        this.riskRewardEvaluator = riskRewardEvaluator;
    }

    @GetMapping("/parameters")
    public ResponseEntity<List<RiskParameter>> getParameters() {
        return ResponseEntity.ok(riskParameterStore.list());
    }

    @GetMapping("/parameters/{name}")
    public ResponseEntity<RiskParameter> getParameter(@PathVariable String name) {
        return ResponseEntity.ok(riskParameterStore.current(riskParameterStore.resolve(name)));
    }

    @PutMapping("/parameters/{name}")
    public ResponseEntity<RiskParameter> updateParameter(
            @PathVariable String name, @Valid @RequestBody RiskParameterUpdateRequest request) {
        RiskParameterName parameter = riskParameterStore.resolve(name);
        log.info("Risk parameter update requested: {} = {}", parameter.getKey(), request.getValue());
        String reason = request.getReason() != null ? request.getReason() : "Manual update";
        return ResponseEntity.ok(
                riskParameterStore.set(parameter, request.getValue(), reason, RiskParameterStore.CHANGED_BY_API));
    }

    @GetMapping("/parameters/{name}/history")
    public ResponseEntity<List<RiskParameterHistory>> getHistory(@PathVariable String name) {
        return ResponseEntity.ok(riskParameterStore.history(riskParameterStore.resolve(name)));
    }

    @GetMapping("/history")
    public ResponseEntity<List<RiskParameterHistory>> getHistoryBetween(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(riskParameterStore.historyBetween(from, to));
    }

    @GetMapping("/risk-reward")
    public ResponseEntity<RiskRewardEvaluation> evaluateRiskReward(
            @RequestParam BigDecimal entry, @RequestParam BigDecimal target, @RequestParam BigDecimal stop) {
        return ResponseEntity.ok(riskRewardEvaluator.evaluate(entry, target, stop));
    }
}
