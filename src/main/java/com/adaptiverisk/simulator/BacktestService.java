package com.adaptiverisk.simulator;

import com.adaptiverisk.api.dto.request.BacktestRequest;
import com.adaptiverisk.config.SimulationConfig;
import com.adaptiverisk.domain.enums.PriceField;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.EquityPoint;
import com.adaptiverisk.domain.model.PriceBar;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.adaptiverisk.exception.BusinessException;
import com.adaptiverisk.exception.ErrorCode;
import com.adaptiverisk.exception.ResourceNotFoundException;
import com.adaptiverisk.observability.EngineMetricsService;
import com.adaptiverisk.pnl.LotMatcher;
import com.adaptiverisk.reporting.PerformanceAnalyzer;
import com.adaptiverisk.reporting.PerformanceStatistics;
import com.adaptiverisk.timeseries.BarInterval;
import com.adaptiverisk.timeseries.HistoricalDataProvider;
import com.adaptiverisk.timeseries.PriceSeriesCache;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Replays historical bars through a {@link SignalStrategy} and reports the outcome.
 *
 * <p>Each run gets its own {@link PriceSeriesCache}, {@link PositionLedger} and
 * {@link TradeSimulator}; runs share nothing. Bars are fetched once up front. Steps follow
 * the first symbol's timeline strictly in order: one equity point per step once the
 * lookback is filled (taken before that step's trades), then each symbol with a bar at the
 * step is offered to the strategy. A final equity point is taken at the last timestamp.
 *
 * <p>Rejected trades are logged and the run continues. Completed reports are kept in
 * memory, oldest evicted first.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final HistoricalDataProvider historicalDataProvider;
    private final LotMatcher lotMatcher;
    private final PerformanceAnalyzer performanceAnalyzer;
    private final SimulationConfig simulationConfig;
    private final EngineMetricsService engineMetricsService;
    private final Map<String, SignalStrategy> strategies;

    /** Newest last. Guarded by {@code this}. */
    private final LinkedHashMap<String, BacktestReport> reports = new LinkedHashMap<>();

    public BacktestService(
            HistoricalDataProvider historicalDataProvider,
            LotMatcher lotMatcher,
            PerformanceAnalyzer performanceAnalyzer,
            SimulationConfig simulationConfig,
            EngineMetricsService engineMetricsService,
            List<SignalStrategy> strategies) {
        this.historicalDataProvider = historicalDataProvider;
        this.lotMatcher = lotMatcher;
        this.performanceAnalyzer = performanceAnalyzer;
        this.simulationConfig = simulationConfig;
        this.engineMetricsService = engineMetricsService;
        this.strategies = strategies.stream().collect(Collectors.toMap(SignalStrategy::getKey, Function.identity()));
    }

    public BacktestReport run(BacktestRequest request) {
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new BusinessException(
                    ErrorCode.BAD_REQUEST,
                    "End date " + request.getEndDate() + " is before start date " + request.getStartDate());
        }
        SignalStrategy strategy = strategies.get(request.getSignal());
        if (strategy == null) {
            throw new BusinessException(
                    ErrorCode.BAD_REQUEST,
                    "Unknown signal strategy '" + request.getSignal() + "'",
                    Map.of("signal", String.valueOf(request.getSignal()), "available", new TreeSet<>(strategies.keySet())));
        }

        BigDecimal initialCapital =
                request.getInitialCapital() != null ? request.getInitialCapital() : simulationConfig.getInitialCapital();
        List<String> symbols = List.copyOf(request.getSymbols());
        String backtestId = "bt_" + LocalDateTime.now().format(ID_FORMAT) + "_"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 8);

        log.info(
                "Backtest {} started: {} on {} from {} to {}, capital {}",
                backtestId,
                strategy.getKey(),
                symbols,
                request.getStartDate(),
                request.getEndDate(),
                initialCapital);

        PriceSeriesCache cache = PriceSeriesCache.load(
                historicalDataProvider,
                symbols,
                request.getStartDate().atStartOfDay(),
                request.getEndDate().atTime(LocalTime.MAX),
                BarInterval.fromLabel(request.getTimeframe()));
        PositionLedger ledger = new PositionLedger(initialCapital);
        TradeSimulator simulator =
                new TradeSimulator(cache, ledger, simulationConfig.getSlippageRate(), simulationConfig.getCommission());

        List<EquityPoint> equityCurve = simulate(request, strategy, symbols, cache, simulator);

        List<SimulatedTrade> trades = simulator.getTrades();
        List<ClosedTrade> closedTrades = lotMatcher.closeTrades(trades);
        PerformanceStatistics statistics = performanceAnalyzer.analyze(equityCurve, closedTrades, initialCapital);

        BacktestReport report = BacktestReport.builder()
                .backtestId(backtestId)
                .strategyName(request.getStrategyName())
                .strategyDescription(request.getStrategyDescription())
                .symbols(symbols)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(statistics.getInitialCapital())
                .finalValue(statistics.getFinalValue())
                .totalReturn(statistics.getTotalReturn())
                .totalReturnPct(statistics.getTotalReturnPct())
                .sharpeRatio(statistics.getSharpeRatio())
                .maxDrawdown(statistics.getMaxDrawdown())
                .winRate(statistics.getTrades().getWinRate())
                .profitFactor(statistics.getTrades().getProfitFactor())
                .totalTrades(statistics.getTrades().getTotalTrades())
                .avgTradePnl(statistics.getTrades().getAveragePnl())
                .tradingDays(statistics.getTradingDays())
                .equityCurve(equityCurve.stream()
                        .map(p -> new EquityCurveEntry(p.getTimestamp().toLocalDate(), p.getEquity()))
                        .toList())
                .tradeHistory(trades)
                .closedTrades(closedTrades)
                .createdAt(LocalDateTime.now())
                .build();

        retain(report);
        log.info(
                "Backtest {} finished: final value {}, return {}%, {} round trips, {} fills",
                backtestId,
                report.getFinalValue(),
                report.getTotalReturnPct(),
                report.getTotalTrades(),
                trades.size());
        return report;
    }

    public BacktestReport find(String backtestId) {
        synchronized (this) {
            BacktestReport report = reports.get(backtestId);
            if (report == null) {
                throw new ResourceNotFoundException("Backtest", backtestId);
            }
            return report;
        }
    }

    /** Most recent reports first, at most {@code limit}. */
    public List<BacktestReport> recent(int limit) {
        List<BacktestReport> newestFirst;
        synchronized (this) {
            newestFirst = new ArrayList<>(reports.values());
        }
        Collections.reverse(newestFirst);
        return newestFirst.subList(0, Math.min(Math.max(limit, 0), newestFirst.size()));
    }

    private List<EquityPoint> simulate(
            BacktestRequest request,
            SignalStrategy strategy,
            List<String> symbols,
            PriceSeriesCache cache,
            TradeSimulator simulator) {
        List<EquityPoint> equityCurve = new ArrayList<>();
        List<LocalDateTime> timeline = cache.timeline(symbols.get(0));
        if (timeline.isEmpty()) {
            log.warn("No bars for {}; backtest has nothing to replay", symbols.get(0));
            return equityCurve;
        }

        PositionLedger ledger = simulator.getPositionLedger();
        for (int i = 0; i < timeline.size(); i++) {
            if (i < request.getLookbackBars()) {
                continue;
            }
            LocalDateTime timestamp = timeline.get(i);
            equityCurve.add(equityAt(cache, ledger, timestamp));

            for (String symbol : symbols) {
                if (!cache.hasBarAt(symbol, timestamp)) {
                    continue;
                }
                List<PriceBar> recentBars = cache.barsUpTo(symbol, timestamp, request.getLookbackBars());
                SignalContext context = SignalContext.builder()
                        .symbol(symbol)
                        .timestamp(timestamp)
                        .recentBars(recentBars)
                        .currentPrice(cache.priceAt(symbol, timestamp, PriceField.CLOSE))
                        .heldQuantity(ledger.quantity(symbol))
                        .cash(ledger.getCash())
                        .allocationFraction(request.getAllocationFraction())
                        .build();

                Optional<TradeSignal> signal = strategy.evaluate(context);
                signal.ifPresent(s -> execute(simulator, strategy, symbol, timestamp, s));
            }
        }

        equityCurve.add(equityAt(cache, ledger, timeline.get(timeline.size() - 1)));
        return equityCurve;
    }

    private void execute(
            TradeSimulator simulator, SignalStrategy strategy, String symbol, LocalDateTime timestamp, TradeSignal signal) {
        TradeExecutionResult result = simulator.execute(
                symbol,
                signal.getSide(),
                signal.getQuantity(),
                timestamp,
                signal.getConfidence(),
                strategy.getDisplayName(),
                signal.getRationale());
        if (result.isFilled()) {
            engineMetricsService.recordTradeFilled();
        } else {
            engineMetricsService.recordTradeRejected(result.getRejectionReason());
            log.warn("Backtest step {} {}: {}", timestamp, symbol, result.getMessage());
        }
    }

    private EquityPoint equityAt(PriceSeriesCache cache, PositionLedger ledger, LocalDateTime timestamp) {
        Function<String, Optional<BigDecimal>> lookup = symbol -> cache.findPrice(symbol, timestamp, PriceField.CLOSE);
        BigDecimal cash = ledger.getCash();
        BigDecimal positionsValue = ledger.positionsValue(lookup);
        return EquityPoint.builder()
                .timestamp(timestamp)
                .equity(cash.add(positionsValue))
                .cash(cash)
                .positionsValue(positionsValue)
                .build();
    }

    private synchronized void retain(BacktestReport report) {
        reports.put(report.getBacktestId(), report);
        while (reports.size() > Math.max(1, simulationConfig.getRetainedReports())) {
            String eldest = reports.keySet().iterator().next();
            reports.remove(eldest);
        }
    }
}
