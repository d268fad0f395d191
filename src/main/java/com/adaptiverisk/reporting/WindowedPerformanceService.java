package com.adaptiverisk.reporting;

import com.adaptiverisk.calibration.CalibrationAnalyzer;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.model.ClosedTrade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rolling 7/30/90-day views of live round trips.
 *
 * <p>Trades are assigned to a window by exit time. Each window is computed on its own
 * subset with the same trade statistics a backtest uses, plus a confidence calibration
 * and a per-strategy breakdown. Trades without a strategy label are left out of the
 * breakdown only.
 */
@Service
public class WindowedPerformanceService {

    private static final Logger log = LoggerFactory.getLogger(WindowedPerformanceService.class);

    private final PerformanceAnalyzer performanceAnalyzer;
    private final CalibrationAnalyzer calibrationAnalyzer;

    public WindowedPerformanceService(PerformanceAnalyzer performanceAnalyzer, CalibrationAnalyzer calibrationAnalyzer) {
        this.performanceAnalyzer = performanceAnalyzer;
        this.calibrationAnalyzer = calibrationAnalyzer;
    }

    public PerformanceWindowReport analyze(LookbackWindow window, List<ClosedTrade> closedTrades, LocalDateTime asOf) {
        List<ClosedTrade> inWindow = closedTrades.stream()
                .filter(t -> window.includes(t.getExitTime(), asOf))
                .toList();
        TradeStatistics statistics = performanceAnalyzer.tradeStatistics(inWindow);

        log.debug("Window {}: {} of {} closed trades", window.getLabel(), inWindow.size(), closedTrades.size());

        return PerformanceWindowReport.builder()
                .timeframe(window.getLabel())
                .from(window.startFrom(asOf))
                .to(asOf)
                .totalTrades(statistics.getTotalTrades())
                .totalPnl(statistics.getTotalPnl())
                .winRate(statistics.getWinRate())
                .avgWin(statistics.getAverageWin())
                .avgLoss(statistics.getAverageLoss())
                .profitFactor(statistics.getProfitFactor())
                .confidenceCalibration(calibrationAnalyzer.calibration(inWindow))
                .strategyPerformance(byStrategy(inWindow))
                .build();
    }

    /** Reports for SHORT, MEDIUM and LONG, in that order. */
    public Map<LookbackWindow, PerformanceWindowReport> analyzeAll(List<ClosedTrade> closedTrades, LocalDateTime asOf) {
        Map<LookbackWindow, PerformanceWindowReport> reports = new EnumMap<>(LookbackWindow.class);
        for (LookbackWindow window : LookbackWindow.values()) {
            reports.put(window, analyze(window, closedTrades, asOf));
        }
        return reports;
    }

    private Map<String, StrategyPerformance> byStrategy(List<ClosedTrade> trades) {
        Map<String, List<ClosedTrade>> grouped = new LinkedHashMap<>();
        for (ClosedTrade trade : trades) {
            if (trade.getStrategyName() == null || trade.getStrategyName().isBlank()) {
                continue;
            }
            grouped.computeIfAbsent(trade.getStrategyName(), k -> new ArrayList<>()).add(trade);
        }

        Map<String, StrategyPerformance> result = new LinkedHashMap<>();
        grouped.forEach((name, list) -> {
            int wins = (int) list.stream().filter(ClosedTrade::isWin).count();
            int losses = (int) list.stream().filter(ClosedTrade::isLoss).count();
            BigDecimal totalPnl = list.stream().map(ClosedTrade::getPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
            result.put(
                    name,
                    StrategyPerformance.builder()
                            .strategyName(name)
                            .trades(list.size())
                            .wins(wins)
                            .losses(losses)
                            .totalPnl(totalPnl)
                            .winRate((double) wins / list.size())
                            .avgPnl(totalPnl.divide(BigDecimal.valueOf(list.size()), 10, RoundingMode.HALF_UP))
                            .build());
        });
        return result;
    }
}
