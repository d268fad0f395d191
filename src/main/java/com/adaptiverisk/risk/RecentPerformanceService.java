package com.adaptiverisk.risk;

import com.adaptiverisk.config.ExecutionGateConfig;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.RecentPerformance;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the {@link RecentPerformance} snapshot the gate decides on.
 *
 * <p>Win rate covers trades closed within the SHORT window; with none it is the configured
 * neutral rate. Daily P&amp;L is the realized P&amp;L of trades closed on the as-of date, and
 * its percentage is taken against the first equity seen that day. The day-start equity
 * resets when the as-of date changes.
 */
@Service
public class RecentPerformanceService {

    private static final Logger log = LoggerFactory.getLogger(RecentPerformanceService.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExecutionGateConfig executionGateConfig;

    private LocalDate currentDay;
    private BigDecimal dayStartEquity;

    public RecentPerformanceService(ExecutionGateConfig executionGateConfig) {
        this.executionGateConfig = executionGateConfig;
    }

    public synchronized RecentPerformance snapshot(
            List<ClosedTrade> closedTrades, BigDecimal currentEquity, LocalDateTime asOf) {
        LocalDate today = asOf.toLocalDate();
        if (!today.equals(currentDay)) {
            log.info("New trading day {}: day-start equity {}", today, currentEquity);
            currentDay = today;
            dayStartEquity = currentEquity;
        }

        List<ClosedTrade> recent = closedTrades.stream()
                .filter(t -> LookbackWindow.SHORT.includes(t.getExitTime(), asOf))
                .toList();
        double winRate = recent.isEmpty()
                ? executionGateConfig.getNeutralWinRate().doubleValue()
                : (double) recent.stream().filter(ClosedTrade::isWin).count() / recent.size();

        BigDecimal dailyPnl = closedTrades.stream()
                .filter(t -> t.getExitTime().toLocalDate().equals(today) && !t.getExitTime().isAfter(asOf))
                .map(ClosedTrade::getPnl)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal dailyPnlPct = dayStartEquity == null || dayStartEquity.signum() <= 0
                ? BigDecimal.ZERO
                : dailyPnl.divide(dayStartEquity, MathContext.DECIMAL64).multiply(HUNDRED);

        return RecentPerformance.builder()
                .winRate(winRate)
                .dailyPnl(dailyPnl)
                .dailyPnlPct(dailyPnlPct)
                .recentTrades(recent.size())
                .build();
    }
}
