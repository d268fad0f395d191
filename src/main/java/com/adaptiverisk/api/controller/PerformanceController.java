package com.adaptiverisk.api.controller;

import com.adaptiverisk.calibration.ThresholdCalibrationService;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.model.ThresholdSuggestion;
import com.adaptiverisk.execution.LiveExecutionService;
import com.adaptiverisk.reporting.PerformanceWindowReport;
import com.adaptiverisk.reporting.WindowedPerformanceService;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for rolling live performance and threshold calibration.
 *
 * <p>All views are recomputed from the live trade stream on each call, keyed by window
 * label (short / medium / long).
 */
@RestController
@RequestMapping("/api/performance")
public class PerformanceController {

    private final WindowedPerformanceService windowedPerformanceService;
    private final ThresholdCalibrationService thresholdCalibrationService;
    private final LiveExecutionService liveExecutionService;

    public PerformanceController(
            WindowedPerformanceService windowedPerformanceService,
            ThresholdCalibrationService thresholdCalibrationService,
            LiveExecutionService liveExecutionService) {
        this.windowedPerformanceService = windowedPerformanceService;
        this.thresholdCalibrationService = thresholdCalibrationService;
        this.liveExecutionService = liveExecutionService;
    }

    @GetMapping("/windows")
    public ResponseEntity<Map<String, PerformanceWindowReport>> getWindows() {
        Map<String, PerformanceWindowReport> reports = new LinkedHashMap<>();
        windowedPerformanceService
                .analyzeAll(liveExecutionService.closedTrades(), LocalDateTime.now())
                .forEach((window, report) -> reports.put(window.getLabel(), report));
        return ResponseEntity.ok(reports);
    }

    @GetMapping("/calibration")
    public ResponseEntity<Map<String, ThresholdSuggestion>> getCalibration() {
        Map<String, ThresholdSuggestion> suggestions = new LinkedHashMap<>();
        thresholdCalibrationService
                .review(liveExecutionService.closedTrades(), LocalDateTime.now())
                .forEach((window, suggestion) -> suggestions.put(window.getLabel(), suggestion));
        return ResponseEntity.ok(suggestions);
    }

    @PostMapping("/calibration/{window}/apply")
    public ResponseEntity<ThresholdSuggestion> applyCalibration(@PathVariable String window) {
        LookbackWindow lookbackWindow = LookbackWindow.fromLabel(window);
        return ResponseEntity.ok(thresholdCalibrationService.apply(
                lookbackWindow, liveExecutionService.closedTrades(), LocalDateTime.now()));
    }
}
