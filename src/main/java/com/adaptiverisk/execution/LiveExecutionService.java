package com.adaptiverisk.execution;

import com.adaptiverisk.api.dto.request.TradeRequest;
import com.adaptiverisk.broker.BrokerGateway;
import com.adaptiverisk.domain.enums.DecisionStatus;
import com.adaptiverisk.domain.enums.OrderType;
import com.adaptiverisk.domain.enums.TradeSide;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.ExecutionReport;
import com.adaptiverisk.domain.model.OrderIntent;
import com.adaptiverisk.domain.model.RecentPerformance;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.adaptiverisk.exception.ResourceNotFoundException;
import com.adaptiverisk.observability.EngineMetricsService;
import com.adaptiverisk.pnl.LotMatcher;
import com.adaptiverisk.risk.AutoExecutionGate;
import com.adaptiverisk.risk.GateResult;
import com.adaptiverisk.risk.PositionSizer;
import com.adaptiverisk.risk.RecentPerformanceService;
import com.adaptiverisk.simulator.PositionLedger;
import com.adaptiverisk.simulator.TradeExecutionResult;
import com.adaptiverisk.simulator.TradeSimulator;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Live decision cycle: gate, size, submit to the broker, settle on the live ledger.
 *
 * <p>Requests may arrive concurrently for different symbols. The gate and sizer read a
 * snapshot; the ledger check and mutation happen inside the simulator's single lock, so
 * two buys cannot both spend the same cash. A broker fill that the ledger then refuses
 * (the cash was spent by a concurrent request in between) is reported as REJECTED.
 *
 * <p>Requests the gate parks for approval are held in memory by approval id until they
 * are approved or rejected. At most {@value #MAX_PENDING_APPROVALS} are held; parking one
 * more drops the oldest, which can then no longer be approved.
 */
@Service
public class LiveExecutionService {

    private static final Logger log = LoggerFactory.getLogger(LiveExecutionService.class);

    public static final int MAX_PENDING_APPROVALS = 100;

    private final AutoExecutionGate autoExecutionGate;
    private final PositionSizer positionSizer;
    private final RecentPerformanceService recentPerformanceService;
    private final BrokerGateway brokerGateway;
    private final TradeSimulator liveTradeSimulator;
    private final LotMatcher lotMatcher;
    private final EngineMetricsService engineMetricsService;

    /** Insertion-ordered, so iteration is oldest first. Guarded by itself. */
    private final Map<String, PendingApproval> pendingApprovals = new LinkedHashMap<>();

    /** Most recent price seen per symbol, used to value open positions. */
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    public LiveExecutionService(
            AutoExecutionGate autoExecutionGate,
            PositionSizer positionSizer,
            RecentPerformanceService recentPerformanceService,
            BrokerGateway brokerGateway,
            TradeSimulator liveTradeSimulator,
            LotMatcher lotMatcher,
            EngineMetricsService engineMetricsService) {
        this.autoExecutionGate = autoExecutionGate;
        this.positionSizer = positionSizer;
        this.recentPerformanceService = recentPerformanceService;
        this.brokerGateway = brokerGateway;
        this.liveTradeSimulator = liveTradeSimulator;
        this.lotMatcher = lotMatcher;
        this.engineMetricsService = engineMetricsService;
    }

    public TradeDecision submit(TradeRequest request) {
        lastPrices.put(request.getSymbol(), request.getPrice());
        LocalDateTime now = LocalDateTime.now();

        RecentPerformance recent = recentPerformanceService.snapshot(closedTrades(), accountValue(), now);
        GateResult gate = autoExecutionGate.evaluate(request.getConfidence(), recent);

        switch (gate.getDecision()) {
            case DENY:
                return TradeDecision.builder()
                        .status(DecisionStatus.BLOCKED)
                        .symbol(request.getSymbol())
                        .gate(gate)
                        .message(gate.getReason())
                        .build();
            case REQUIRE_APPROVAL:
                PendingApproval pending = PendingApproval.builder()
                        .approvalId(UUID.randomUUID().toString())
                        .request(request)
                        .gate(gate)
                        .createdAt(now)
                        .build();
                park(pending);
                log.info(
                        "{} {} parked for approval {}: confidence {} below threshold {} by {}",
                        request.getSide(),
                        request.getSymbol(),
                        pending.getApprovalId(),
                        request.getConfidence(),
                        gate.getEffectiveThreshold(),
                        gate.getGap());
                return TradeDecision.builder()
                        .status(DecisionStatus.PENDING_APPROVAL)
                        .symbol(request.getSymbol())
                        .gate(gate)
                        .approvalId(pending.getApprovalId())
                        .message("Confidence is " + gate.getGap() + " below the auto-trade threshold")
                        .build();
            default:
                return execute(request, gate);
        }
    }

    /**
     * Executes a parked request as-is; the gate is not consulted again.
     */
    public TradeDecision approve(String approvalId) {
        PendingApproval pending = take(approvalId);
        log.info("Approval {} granted for {} {}", approvalId, pending.getRequest().getSide(), pending.getRequest().getSymbol());
        return execute(pending.getRequest(), null);
    }

    public TradeDecision reject(String approvalId) {
        PendingApproval pending = take(approvalId);
        log.info("Approval {} rejected for {} {}", approvalId, pending.getRequest().getSide(), pending.getRequest().getSymbol());
        return TradeDecision.builder()
                .status(DecisionStatus.DISCARDED)
                .symbol(pending.getRequest().getSymbol())
                .message("Rejected by approver")
                .build();
    }

    /** Parked requests, oldest first. */
    public List<PendingApproval> pendingApprovals() {
        synchronized (pendingApprovals) {
            return new ArrayList<>(pendingApprovals.values());
        }
    }

    /** Live trade stream in execution order. */
    public List<SimulatedTrade> trades() {
        return liveTradeSimulator.getTrades();
    }

    /** FIFO-matched round trips of the live trade stream. */
    public List<ClosedTrade> closedTrades() {
        return lotMatcher.closeTrades(liveTradeSimulator.getTrades());
    }

    /** Cash plus open positions at the last seen prices. */
    public BigDecimal accountValue() {
        return liveTradeSimulator.getPositionLedger().portfolioValue(this::lastPrice);
    }

    private TradeDecision execute(TradeRequest request, GateResult gate) {
        int quantity = resolveQuantity(request);
        if (quantity <= 0) {
            return TradeDecision.builder()
                    .status(DecisionStatus.REJECTED)
                    .symbol(request.getSymbol())
                    .quantity(0)
                    .gate(gate)
                    .message("Nothing to trade: sized to zero shares")
                    .build();
        }

        OrderIntent intent = OrderIntent.builder()
                .symbol(request.getSymbol())
                .side(request.getSide())
                .quantity(quantity)
                .orderType(request.getOrderType() != null ? request.getOrderType() : OrderType.MARKET)
                .referencePrice(request.getPrice())
                .build();
        ExecutionReport report = brokerGateway.submit(intent);
        if (!report.isFilled()) {
            log.warn("Broker refused {} {} x{}: {}", request.getSide(), request.getSymbol(), quantity, report.getMessage());
            return TradeDecision.builder()
                    .status(DecisionStatus.REJECTED)
                    .symbol(request.getSymbol())
                    .quantity(quantity)
                    .gate(gate)
                    .message(report.getMessage())
                    .build();
        }

        lastPrices.put(request.getSymbol(), report.getFillPrice());
        TradeExecutionResult result = liveTradeSimulator.recordFill(
                request.getSymbol(),
                request.getSide(),
                report.getFilledQuantity(),
                report.getFillPrice(),
                LocalDateTime.now(),
                request.getConfidence(),
                request.getStrategyName(),
                request.getRationale());

        if (result.isRejected()) {
            engineMetricsService.recordTradeRejected(result.getRejectionReason());
            log.warn(
                    "Ledger refused broker fill {} for {} {}: {}",
                    report.getBrokerOrderId(),
                    request.getSide(),
                    request.getSymbol(),
                    result.getMessage());
            return TradeDecision.builder()
                    .status(DecisionStatus.REJECTED)
                    .symbol(request.getSymbol())
                    .quantity(quantity)
                    .gate(gate)
                    .message(result.getRejectionReason() + ": " + result.getMessage())
                    .build();
        }

        engineMetricsService.recordTradeFilled();
        log.info(
                "Executed {} {} x{} @ {} (order {})",
                request.getSide(),
                request.getSymbol(),
                report.getFilledQuantity(),
                report.getFillPrice(),
                report.getBrokerOrderId());
        return TradeDecision.builder()
                .status(DecisionStatus.EXECUTED)
                .symbol(request.getSymbol())
                .quantity(report.getFilledQuantity())
                .gate(gate)
                .trade(result.getTrade())
                .message("Filled by " + report.getBrokerOrderId())
                .build();
    }

    private int resolveQuantity(TradeRequest request) {
        if (request.getQuantity() != null) {
            return request.getQuantity();
        }
        PositionLedger ledger = liveTradeSimulator.getPositionLedger();
        if (request.getSide() == TradeSide.SELL) {
            return ledger.quantity(request.getSymbol());
        }

        BigDecimal accountValue = accountValue();
        BigDecimal exposure = accountValue.signum() > 0
                ? ledger.positionsValue(this::lastPrice).divide(accountValue, MathContext.DECIMAL64)
                : BigDecimal.ZERO;
        return positionSizer.size(
                request.getSymbol(), request.getConfidence(), accountValue, request.getPrice(), exposure);
    }

    private void park(PendingApproval pending) {
        synchronized (pendingApprovals) {
            pendingApprovals.put(pending.getApprovalId(), pending);
            Iterator<PendingApproval> oldest = pendingApprovals.values().iterator();
            while (pendingApprovals.size() > MAX_PENDING_APPROVALS) {
                PendingApproval dropped = oldest.next();
                oldest.remove();
                log.warn(
                        "Approval {} for {} {} dropped: more than {} requests awaiting approval",
                        dropped.getApprovalId(),
                        dropped.getRequest().getSide(),
                        dropped.getRequest().getSymbol(),
                        MAX_PENDING_APPROVALS);
            }
        }
    }

    private PendingApproval take(String approvalId) {
        PendingApproval pending;
        synchronized (pendingApprovals) {
            pending = pendingApprovals.remove(approvalId);
        }
        if (pending == null) {
            throw new ResourceNotFoundException("Approval", approvalId);
        }
        return pending;
    }

    private Optional<BigDecimal> lastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }
}
