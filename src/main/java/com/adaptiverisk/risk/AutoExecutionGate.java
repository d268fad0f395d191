package com.adaptiverisk.risk;

import com.adaptiverisk.config.ExecutionGateConfig;
import com.adaptiverisk.domain.enums.GateDecision;
import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.model.RecentPerformance;
import com.adaptiverisk.observability.EngineMetricsService;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a trade auto-executes, needs manual approval, or is blocked.
 *
 * <p>Decision order:
 * <ol>
 *   <li>Circuit breaker: daily P&amp;L below -(fraction x daily loss limit) denies the trade,
 *       whatever its confidence.</li>
 *   <li>Effective threshold: the stored auto-trade threshold, raised by a penalty while the
 *       recent win rate is below the floor.</li>
 *   <li>Confidence at or above the effective threshold allows; anything else requires
 *       approval.</li>
 * </ol>
 *
 * <p>The raised threshold is not capped at 1.0; a threshold near the top plus the penalty
 * means every trade needs approval until the win rate recovers.
 */
@Service
public class AutoExecutionGate {

    private static final Logger log = LoggerFactory.getLogger(AutoExecutionGate.class);

    private final RiskParameterStore riskParameterStore;
    private final ExecutionGateConfig executionGateConfig;
    private final EngineMetricsService engineMetricsService;

    public AutoExecutionGate(
            RiskParameterStore riskParameterStore,
            ExecutionGateConfig executionGateConfig,
            EngineMetricsService engineMetricsService) {
        this.riskParameterStore = riskParameterStore;
        this.executionGateConfig = executionGateConfig;
        this.engineMetricsService = engineMetricsService;
    }

    public GateResult evaluate(BigDecimal confidence, RecentPerformance recentPerformance) {
        RecentPerformance recent = recentPerformance != null ? recentPerformance : RecentPerformance.neutral();
        BigDecimal baseThreshold = riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD);

        GateResult result = decide(confidence, recent, baseThreshold);
        engineMetricsService.recordGateDecision(result.getDecision());
        if (result.isDenied()) {
            log.info("Auto-execution denied: {}", result.getReason());
        } else {
            log.debug(
                    "Gate {}: confidence={} effectiveThreshold={}",
                    result.getDecision(),
                    confidence,
                    result.getEffectiveThreshold());
        }
        return result;
    }

    private GateResult decide(BigDecimal confidence, RecentPerformance recent, BigDecimal baseThreshold) {
        BigDecimal lossLimit = riskParameterStore.get(RiskParameterName.DAILY_LOSS_LIMIT_PCT);
        BigDecimal breakerLevel =
                executionGateConfig.getCircuitBreakerFraction().multiply(lossLimit).negate();
        BigDecimal dailyPnlPct = recent.getDailyPnlPct() != null ? recent.getDailyPnlPct() : BigDecimal.ZERO;

        if (dailyPnlPct.compareTo(breakerLevel) < 0) {
            return GateResult.builder()
                    .decision(GateDecision.DENY)
                    .confidence(confidence)
                    .baseThreshold(baseThreshold)
                    .effectiveThreshold(baseThreshold)
                    .gap(BigDecimal.ZERO)
                    .reason("Daily P&L " + dailyPnlPct + "% is past the circuit breaker at " + breakerLevel
                            + "% (loss limit " + lossLimit + "%)")
                    .build();
        }

        BigDecimal effectiveThreshold = baseThreshold;
        String reason = "Confidence compared against threshold " + baseThreshold;
        if (BigDecimal.valueOf(recent.getWinRate()).compareTo(executionGateConfig.getLowWinRateFloor()) < 0) {
            effectiveThreshold = baseThreshold.add(executionGateConfig.getLowWinRatePenalty());
            reason = "Recent win rate " + recent.getWinRate() + " below "
                    + executionGateConfig.getLowWinRateFloor() + ", threshold raised to " + effectiveThreshold;
        }

        if (confidence.compareTo(effectiveThreshold) >= 0) {
            return GateResult.builder()
                    .decision(GateDecision.ALLOW)
                    .confidence(confidence)
                    .baseThreshold(baseThreshold)
                    .effectiveThreshold(effectiveThreshold)
                    .gap(BigDecimal.ZERO)
                    .reason(reason)
                    .build();
        }

        return GateResult.builder()
                .decision(GateDecision.REQUIRE_APPROVAL)
                .confidence(confidence)
                .baseThreshold(baseThreshold)
                .effectiveThreshold(effectiveThreshold)
                .gap(effectiveThreshold.subtract(confidence))
                .reason(reason)
                .build();
    }
}
