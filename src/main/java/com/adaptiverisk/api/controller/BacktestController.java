package com.adaptiverisk.api.controller;

import com.adaptiverisk.api.dto.request.BacktestRequest;
import com.adaptiverisk.simulator.BacktestReport;
import com.adaptiverisk.simulator.BacktestService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for backtests: run one synchronously, fetch a retained report, list
 * the most recent ones.
 */
@RestController
@RequestMapping("/api/backtests")
public class BacktestController {

    private final BacktestService backtestService;

    public BacktestController(BacktestService backtestService) {
        this.backtestService = backtestService;
    }

    @PostMapping
    public ResponseEntity<BacktestReport> runBacktest(@Valid @RequestBody BacktestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(backtestService.run(request));
    }

    @GetMapping("/{backtestId}")
    public ResponseEntity<BacktestReport> getBacktest(@PathVariable String backtestId) {
        return ResponseEntity.ok(backtestService.find(backtestId));
    }

    @GetMapping
    public ResponseEntity<List<BacktestReport>> listBacktests(@RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(backtestService.recent(limit));
    }
}
