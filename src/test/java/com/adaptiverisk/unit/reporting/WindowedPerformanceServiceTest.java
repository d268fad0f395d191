package com.adaptiverisk.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;

import com.adaptiverisk.calibration.CalibrationAnalyzer;
import com.adaptiverisk.config.CalibrationConfig;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.reporting.PerformanceAnalyzer;
import com.adaptiverisk.reporting.PerformanceWindowReport;
import com.adaptiverisk.reporting.StrategyPerformance;
import com.adaptiverisk.reporting.WindowedPerformanceService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WindowedPerformanceServiceTest {

    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 6, 30, 16, 0);

    private final WindowedPerformanceService service =
            new WindowedPerformanceService(new PerformanceAnalyzer(), new CalibrationAnalyzer(new CalibrationConfig()));

    private final List<ClosedTrade> trades = List.of(
            closed("100", 2, "Momentum", "0.9"),
            closed("-50", 5, "Momentum", "0.65"),
            closed("40", 20, "Reversal", "0.5"),
            closed("-30", 60, "Reversal", "0.85"),
            closed("500", 120, "Momentum", "0.9"));

    @Test
    @DisplayName("Each window only sees trades exited inside it")
    void windowsFilterByExitTime() {
        Map<LookbackWindow, PerformanceWindowReport> reports = service.analyzeAll(trades, AS_OF);

        assertThat(reports).containsOnlyKeys(LookbackWindow.SHORT, LookbackWindow.MEDIUM, LookbackWindow.LONG);
        assertThat(reports.get(LookbackWindow.SHORT).getTotalTrades()).isEqualTo(2);
        assertThat(reports.get(LookbackWindow.MEDIUM).getTotalTrades()).isEqualTo(3);
        assertThat(reports.get(LookbackWindow.LONG).getTotalTrades()).isEqualTo(4);
        assertThat(reports.get(LookbackWindow.LONG).getTotalPnl()).isEqualByComparingTo("60");
    }

    @Test
    @DisplayName("Window bounds are [asOf - days, asOf]")
    void windowBounds() {
        PerformanceWindowReport report = service.analyze(LookbackWindow.SHORT, trades, AS_OF);

        assertThat(report.getTimeframe()).isEqualTo("short");
        assertThat(report.getFrom()).isEqualTo(AS_OF.minusDays(7));
        assertThat(report.getTo()).isEqualTo(AS_OF);
    }

    @Test
    @DisplayName("Win rate and profit factor are computed on the window subset")
    void windowStatistics() {
        PerformanceWindowReport report = service.analyze(LookbackWindow.SHORT, trades, AS_OF);

        assertThat(report.getWinRate()).isEqualTo(0.5);
        assertThat(report.getAvgWin()).isEqualByComparingTo("100");
        assertThat(report.getAvgLoss()).isEqualByComparingTo("-50");
        assertThat(report.getProfitFactor()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Per-strategy breakdown skips unlabeled trades")
    void strategyBreakdown() {
        List<ClosedTrade> withUnlabeled = List.of(
                closed("100", 1, "Momentum", "0.9"),
                closed("-20", 1, "Momentum", "0.9"),
                closed("10", 1, null, "0.9"),
                closed("10", 1, " ", "0.9"));

        PerformanceWindowReport report = service.analyze(LookbackWindow.SHORT, withUnlabeled, AS_OF);

        assertThat(report.getTotalTrades()).isEqualTo(4);
        assertThat(report.getStrategyPerformance()).containsOnlyKeys("Momentum");
        StrategyPerformance momentum = report.getStrategyPerformance().get("Momentum");
        assertThat(momentum.getTrades()).isEqualTo(2);
        assertThat(momentum.getWins()).isEqualTo(1);
        assertThat(momentum.getLosses()).isEqualTo(1);
        assertThat(momentum.getTotalPnl()).isEqualByComparingTo("80");
        assertThat(momentum.getAvgPnl()).isEqualByComparingTo("40");
        assertThat(momentum.getWinRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Calibration is attached per window")
    void calibrationAttached() {
        PerformanceWindowReport report = service.analyze(LookbackWindow.SHORT, trades, AS_OF);

        assertThat(report.getConfidenceCalibration().getHighConfidence().getCount()).isEqualTo(1);
        assertThat(report.getConfidenceCalibration().getMediumConfidence().getCount()).isEqualTo(1);
        assertThat(report.getConfidenceCalibration().getLowConfidence().getCount()).isZero();
    }

    @Test
    @DisplayName("Empty window reports zeros")
    void emptyWindow() {
        PerformanceWindowReport report = service.analyze(LookbackWindow.SHORT, List.of(), AS_OF);

        assertThat(report.getTotalTrades()).isZero();
        assertThat(report.getProfitFactor()).isZero();
        assertThat(report.getStrategyPerformance()).isEmpty();
        assertThat(report.getConfidenceCalibration().isWellCalibrated()).isFalse();
    }

    private static ClosedTrade closed(String pnl, int daysAgo, String strategy, String confidence) {
        return ClosedTrade.builder()
                .symbol("AAPL")
                .quantity(1)
                .entryPrice(new BigDecimal("100"))
                .exitPrice(new BigDecimal("100").add(new BigDecimal(pnl)))
                .pnl(new BigDecimal(pnl))
                .pnlPct(new BigDecimal(pnl))
                .entryTime(AS_OF.minusDays(daysAgo + 1L))
                .exitTime(AS_OF.minusDays(daysAgo))
                .entryConfidence(new BigDecimal(confidence))
                .strategyName(strategy)
                .build();
    }
}
