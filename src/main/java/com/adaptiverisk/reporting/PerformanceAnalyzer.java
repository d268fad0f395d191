package com.adaptiverisk.reporting;

import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.EquityPoint;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an equity curve and a set of closed trades into return, Sharpe, drawdown,
 * win-rate and profit-factor statistics.
 *
 * <p>Used both for a finished backtest and for rolling live windows; windowing is the
 * caller's job (filter trades and equity points before calling).
 *
 * <p>Degenerate inputs resolve to neutral values instead of errors: Sharpe is 0 with
 * fewer than two period returns or zero variance, drawdown is 0 for a curve that never
 * falls, win rate and profit factor are 0 with no trades, and profit factor is
 * {@link Double#POSITIVE_INFINITY} when nothing lost.
 */
@Service
public class PerformanceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PerformanceAnalyzer.class);

    static final double TRADING_DAYS_PER_YEAR = 252.0;

    /** Standard deviations at or below this are treated as zero variance. */
    private static final double VARIANCE_EPSILON = 1e-12;

    private static final MathContext RATIO_CONTEXT = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Full report for an equity curve and its closed trades.
     *
     * @param equityCurve    equity points in time order
     * @param closedTrades   matched round trips
     * @param initialCapital starting capital (must be positive for percentage returns)
     */
    public PerformanceStatistics analyze(
            List<EquityPoint> equityCurve, List<ClosedTrade> closedTrades, BigDecimal initialCapital) {
        BigDecimal finalValue =
                equityCurve.isEmpty() ? initialCapital : equityCurve.get(equityCurve.size() - 1).getEquity();
        BigDecimal totalReturn = finalValue.subtract(initialCapital);
        BigDecimal totalReturnPct = initialCapital.signum() == 0
                ? BigDecimal.ZERO
                : totalReturn.divide(initialCapital, RATIO_CONTEXT).multiply(HUNDRED);

        List<BigDecimal> equities = equityCurve.stream().map(EquityPoint::getEquity).toList();

        PerformanceStatistics statistics = PerformanceStatistics.builder()
                .initialCapital(initialCapital)
                .finalValue(finalValue)
                .totalReturn(totalReturn)
                .totalReturnPct(totalReturnPct)
                .sharpeRatio(sharpeRatio(periodReturns(equities)))
                .maxDrawdown(maxDrawdown(equities))
                .tradingDays(equityCurve.size())
                .trades(tradeStatistics(closedTrades))
                .build();

        log.debug(
                "Performance: return={} ({}%), sharpe={}, maxDD={}%, trades={}",
                totalReturn,
                totalReturnPct,
                statistics.getSharpeRatio(),
                statistics.getMaxDrawdown(),
                statistics.getTrades().getTotalTrades());
        return statistics;
    }

    /**
     * Win/loss statistics for a set of closed trades.
     */
    public TradeStatistics tradeStatistics(List<ClosedTrade> closedTrades) {
        if (closedTrades.isEmpty()) {
            return TradeStatistics.empty();
        }

        int total = closedTrades.size();
        List<BigDecimal> wins = new ArrayList<>();
        List<BigDecimal> losses = new ArrayList<>();
        BigDecimal totalPnl = BigDecimal.ZERO;
        for (ClosedTrade trade : closedTrades) {
            totalPnl = totalPnl.add(trade.getPnl());
            if (trade.isWin()) {
                wins.add(trade.getPnl());
            } else if (trade.isLoss()) {
                losses.add(trade.getPnl());
            }
        }

        BigDecimal grossProfit = wins.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal lossSum = losses.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal grossLoss = lossSum.abs();

        return TradeStatistics.builder()
                .totalTrades(total)
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRate((double) wins.size() / total)
                .totalPnl(totalPnl)
                .averagePnl(average(totalPnl, total))
                .grossProfit(grossProfit)
                .grossLoss(grossLoss)
                .averageWin(average(grossProfit, wins.size()))
                .averageLoss(average(lossSum, losses.size()))
                .profitFactor(profitFactor(grossProfit, grossLoss))
                .build();
    }

    /**
     * Pointwise fractional change between consecutive equity values. A step from zero
     * equity has no defined return and is skipped.
     */
    List<Double> periodReturns(List<BigDecimal> equities) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equities.size(); i++) {
            BigDecimal previous = equities.get(i - 1);
            if (previous.signum() == 0) {
                continue;
            }
            BigDecimal change = equities.get(i).subtract(previous).divide(previous, RATIO_CONTEXT);
            returns.add(change.doubleValue());
        }
        return returns;
    }

    /**
     * (mean / sample standard deviation) * sqrt(252); 0 with fewer than two returns or
     * zero variance.
     */
    double sharpeRatio(List<Double> returns) {
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double sumSquares = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .sum();
        double stdDev = Math.sqrt(sumSquares / (returns.size() - 1));
        if (!(stdDev > VARIANCE_EPSILON)) {
            return 0.0;
        }
        return (mean / stdDev) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /**
     * Minimum of (equity - running peak) / running peak over the curve, as a percentage.
     */
    double maxDrawdown(List<BigDecimal> equities) {
        BigDecimal peak = null;
        BigDecimal worst = BigDecimal.ZERO;
        for (BigDecimal equity : equities) {
            if (peak == null || equity.compareTo(peak) > 0) {
                peak = equity;
            }
            if (peak.signum() <= 0) {
                continue;
            }
            BigDecimal drawdown = equity.subtract(peak).divide(peak, RATIO_CONTEXT);
            if (drawdown.compareTo(worst) < 0) {
                worst = drawdown;
            }
        }
        return worst.signum() == 0 ? 0.0 : worst.multiply(HUNDRED).doubleValue();
    }

    private double profitFactor(BigDecimal grossProfit, BigDecimal grossLoss) {
        if (grossLoss.signum() > 0) {
            return grossProfit.divide(grossLoss, RATIO_CONTEXT).doubleValue();
        }
        return grossProfit.signum() > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }

    private BigDecimal average(BigDecimal sum, int count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return sum.divide(BigDecimal.valueOf(count), 10, RoundingMode.HALF_UP);
    }
}
