package com.adaptiverisk.observability;

import com.adaptiverisk.domain.enums.GateDecision;
import com.adaptiverisk.domain.enums.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer counters for the risk engine.
 *
 * <ul>
 *   <li><b>gate.decisions</b>: auto-execution gate outcomes, tagged by decision</li>
 *   <li><b>trades.rejected</b>: simulator rejections, tagged by reason</li>
 *   <li><b>trades.filled</b>: accepted trades</li>
 *   <li><b>risk.parameter.updates</b>: accepted parameter changes, tagged by name and source</li>
 * </ul>
 *
 * <p>Tagged counters are resolved through the registry on each call; Micrometer caches
 * the meter per tag set.
 */
@Service
public class EngineMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter tradesFilledCounter;

    public EngineMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.tradesFilledCounter = Counter.builder("trades.filled")
                .description("Trades settled against the position ledger")
                .register(meterRegistry);
    }

    public void recordGateDecision(GateDecision decision) {
        Counter.builder("gate.decisions")
                .description("Auto-execution gate outcomes")
                .tag("decision", decision.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordTradeFilled() {
        tradesFilledCounter.increment();
    }

    public void recordTradeRejected(RejectionReason reason) {
        Counter.builder("trades.rejected")
                .description("Trades refused by the simulator")
                .tag("reason", reason.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordParameterUpdate(String name, String changedBy) {
        Counter.builder("risk.parameter.updates")
                .description("Accepted risk parameter changes")
                .tag("parameter", name)
                .tag("source", changedBy)
                .register(meterRegistry)
                .increment();
    }
}
