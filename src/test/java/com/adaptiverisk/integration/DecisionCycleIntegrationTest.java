package com.adaptiverisk.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import com.adaptiverisk.api.dto.request.TradeRequest;
import com.adaptiverisk.broker.PaperBrokerGateway;
import com.adaptiverisk.calibration.CalibrationAnalyzer;
import com.adaptiverisk.calibration.ThresholdCalibrationService;
import com.adaptiverisk.config.CalibrationConfig;
import com.adaptiverisk.config.ExecutionGateConfig;
import com.adaptiverisk.domain.enums.DecisionStatus;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.enums.TradeSide;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.ThresholdSuggestion;
import com.adaptiverisk.execution.LiveExecutionService;
import com.adaptiverisk.execution.TradeDecision;
import com.adaptiverisk.observability.EngineMetricsService;
import com.adaptiverisk.pnl.LotMatcher;
import com.adaptiverisk.risk.AutoExecutionGate;
import com.adaptiverisk.risk.PositionSizer;
import com.adaptiverisk.risk.RecentPerformanceService;
import com.adaptiverisk.risk.RiskParameterPersistenceService;
import com.adaptiverisk.risk.RiskParameterStore;
import com.adaptiverisk.simulator.PositionLedger;
import com.adaptiverisk.simulator.TradeSimulator;
import com.adaptiverisk.timeseries.PriceSeriesCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Cross-service integration test for the live decision cycle.
 * Wires real RiskParameterStore + AutoExecutionGate + PositionSizer + PaperBrokerGateway
 * + TradeSimulator + LotMatcher together with only persistence mocked to verify:
 * gate -> size -> fill -> ledger -> FIFO P&L -> circuit breaker -> calibration.
 */
@ExtendWith(MockitoExtension.class)
class DecisionCycleIntegrationTest {

    @Mock
    private RiskParameterPersistenceService persistenceService;

    private SimpleMeterRegistry meterRegistry;
    private RiskParameterStore riskParameterStore;
    private LiveExecutionService liveExecutionService;
    private ThresholdCalibrationService thresholdCalibrationService;
    private TradeSimulator liveTradeSimulator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        EngineMetricsService metrics = new EngineMetricsService(meterRegistry);
        ExecutionGateConfig gateConfig = new ExecutionGateConfig();

        riskParameterStore = new RiskParameterStore(persistenceService, metrics);
        liveTradeSimulator = new TradeSimulator(
                PriceSeriesCache.empty(), new PositionLedger(new BigDecimal("100000")), BigDecimal.ZERO, BigDecimal.ZERO);
        liveExecutionService = new LiveExecutionService(
                new AutoExecutionGate(riskParameterStore, gateConfig, metrics),
                new PositionSizer(riskParameterStore),
                new RecentPerformanceService(gateConfig),
                new PaperBrokerGateway(),
                liveTradeSimulator,
                new LotMatcher(),
                metrics);
        thresholdCalibrationService =
                new ThresholdCalibrationService(new CalibrationAnalyzer(new CalibrationConfig()), riskParameterStore);
    }

    private static TradeRequest request(TradeSide side, String price, String confidence) {
        TradeRequest request = new TradeRequest();
        request.setSymbol("AAPL");
        request.setSide(side);
        request.setPrice(new BigDecimal(price));
        request.setConfidence(new BigDecimal(confidence));
        request.setStrategyName("Momentum");
        return request;
    }

    private double gateCount(String decision) {
        return meterRegistry.counter("gate.decisions", "decision", decision).count();
    }

    @Test
    @DisplayName("High-confidence buy is sized from confidence and filled on the ledger")
    void autoExecutedBuy() {
        TradeDecision decision = liveExecutionService.submit(request(TradeSide.BUY, "100", "0.97"));

        // 10% cap x 0.97 confidence of 100000 at 100 per share
        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.EXECUTED);
        assertThat(decision.getQuantity()).isEqualTo(97);
        assertThat(liveTradeSimulator.getPositionLedger().getCash()).isEqualByComparingTo("90300");
        assertThat(liveExecutionService.accountValue()).isEqualByComparingTo("100000");
        assertThat(gateCount("ALLOW")).isEqualTo(1.0);
        assertThat(meterRegistry.counter("trades.filled").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Below-threshold buy waits for approval, then executes against current exposure")
    void approvalFlow() {
        liveExecutionService.submit(request(TradeSide.BUY, "100", "0.97"));

        TradeDecision parked = liveExecutionService.submit(request(TradeSide.BUY, "100", "0.90"));
        assertThat(parked.getStatus()).isEqualTo(DecisionStatus.PENDING_APPROVAL);
        assertThat(parked.getGate().getGap()).isEqualByComparingTo("0.05");
        assertThat(liveExecutionService.pendingApprovals()).hasSize(1);
        assertThat(liveTradeSimulator.getPositionLedger().quantity("AAPL")).isEqualTo(97);

        TradeDecision approved = liveExecutionService.approve(parked.getApprovalId());

        assertThat(approved.getStatus()).isEqualTo(DecisionStatus.EXECUTED);
        assertThat(approved.getQuantity()).isEqualTo(90);
        assertThat(liveTradeSimulator.getPositionLedger().quantity("AAPL")).isEqualTo(187);
        assertThat(liveExecutionService.pendingApprovals()).isEmpty();
    }

    @Test
    @DisplayName("Realized daily loss past the breaker blocks even a high-confidence trade")
    void circuitBreakerAfterLosses() {
        liveExecutionService.submit(request(TradeSide.BUY, "100", "0.97"));
        TradeDecision parked = liveExecutionService.submit(request(TradeSide.BUY, "100", "0.90"));
        liveExecutionService.approve(parked.getApprovalId());

        TradeDecision exit = liveExecutionService.submit(request(TradeSide.SELL, "80", "0.97"));
        assertThat(exit.getStatus()).isEqualTo(DecisionStatus.EXECUTED);
        assertThat(exit.getQuantity()).isEqualTo(187);

        List<ClosedTrade> closed = liveExecutionService.closedTrades();
        assertThat(closed).hasSize(2);
        assertThat(closed.get(0).getPnl()).isEqualByComparingTo("-1940");
        assertThat(closed.get(1).getPnl()).isEqualByComparingTo("-1800");
        assertThat(liveExecutionService.accountValue()).isEqualByComparingTo("96260");

        // -3.74% realized today against a -1.6% breaker
        TradeDecision blocked = liveExecutionService.submit(request(TradeSide.BUY, "80", "0.99"));

        assertThat(blocked.getStatus()).isEqualTo(DecisionStatus.BLOCKED);
        assertThat(blocked.getMessage()).contains("circuit breaker");
        assertThat(liveTradeSimulator.getTrades()).hasSize(3);
        assertThat(gateCount("DENY")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Raising the threshold through the store changes the next gate decision")
    void thresholdUpdateTakesEffect() {
        riskParameterStore.set(
                RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD,
                new BigDecimal("0.98"),
                "Tighten after review",
                RiskParameterStore.CHANGED_BY_API);

        TradeDecision decision = liveExecutionService.submit(request(TradeSide.BUY, "100", "0.97"));

        assertThat(decision.getStatus()).isEqualTo(DecisionStatus.PENDING_APPROVAL);
        assertThat(decision.getGate().getEffectiveThreshold()).isEqualByComparingTo("0.98");
        verify(persistenceService).save(any(), eq(new BigDecimal("0.95")), eq(RiskParameterStore.CHANGED_BY_API));
    }

    @Test
    @DisplayName("Calibration on a thin live history leaves the threshold alone")
    void calibrationWithoutEnoughData() {
        liveExecutionService.submit(request(TradeSide.BUY, "100", "0.97"));
        liveExecutionService.submit(request(TradeSide.SELL, "110", "0.97"));

        ThresholdSuggestion suggestion = thresholdCalibrationService.apply(
                LookbackWindow.SHORT, liveExecutionService.closedTrades(), LocalDateTime.now());

        assertThat(suggestion.isShouldChange()).isFalse();
        assertThat(riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD))
                .isEqualByComparingTo("0.95");
    }
}
