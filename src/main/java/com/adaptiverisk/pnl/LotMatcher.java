package com.adaptiverisk.pnl;

import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.Lot;
import com.adaptiverisk.domain.model.SimulatedTrade;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs closed round trips from a raw trade stream using FIFO lot matching.
 *
 * <p>Each buy opens a new {@link Lot} at the back of its symbol's queue. Each sell
 * consumes lots from the front: it matches {@code min(remaining sell, lot remaining)},
 * emits one {@link ClosedTrade} with {@code pnl = (sell - entry) * matched}, and drops the
 * lot once it is fully consumed. One sell can therefore close several lots, and one lot
 * can be split across several sells.
 *
 * <p>A sell with no open lot for its symbol is ignored: short positions are not tracked.
 * Matching is a pure function of the stream, so replaying the same stream always yields
 * the same closed trades.
 */
@Component
public class LotMatcher {

    private static final Logger log = LoggerFactory.getLogger(LotMatcher.class);

    private static final MathContext PCT_CONTEXT = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Closed trades in the order they were produced by the stream.
     */
    public List<ClosedTrade> closeTrades(List<SimulatedTrade> trades) {
        return match(trades).closedTrades;
    }

    /**
     * Lots still open after the whole stream has been replayed, per symbol, oldest first.
     */
    public Map<String, List<Lot>> openLots(List<SimulatedTrade> trades) {
        Map<String, List<Lot>> open = new HashMap<>();
        match(trades).queues.forEach((symbol, queue) -> {
            if (!queue.isEmpty()) {
                open.put(symbol, List.copyOf(queue));
            }
        });
        return open;
    }

    private MatchState match(List<SimulatedTrade> trades) {
        MatchState state = new MatchState();
        for (SimulatedTrade trade : trades) {
            if (trade.isBuy()) {
                state.queues
                        .computeIfAbsent(trade.getSymbol(), s -> new ArrayDeque<>())
                        .addLast(Lot.builder()
                                .symbol(trade.getSymbol())
                                .entryPrice(trade.getFillPrice())
                                .remainingQuantity(trade.getQuantity())
                                .entryTime(trade.getTimestamp())
                                .confidence(trade.getConfidence())
                                .strategyName(trade.getStrategyName())
                                .build());
            } else {
                closeAgainstLots(trade, state);
            }
        }
        return state;
    }

    private void closeAgainstLots(SimulatedTrade sell, MatchState state) {
        Deque<Lot> queue = state.queues.get(sell.getSymbol());
        if (queue == null || queue.isEmpty()) {
            log.debug("Ignoring SELL {} x{}: no open lot", sell.getSymbol(), sell.getQuantity());
            return;
        }

        int remaining = sell.getQuantity();
        while (remaining > 0 && !queue.isEmpty()) {
            Lot lot = queue.peekFirst();
            int matched = Math.min(remaining, lot.getRemainingQuantity());

            BigDecimal priceDiff = sell.getFillPrice().subtract(lot.getEntryPrice());
            BigDecimal pnl = priceDiff.multiply(BigDecimal.valueOf(matched));
            BigDecimal pnlPct = lot.getEntryPrice().signum() == 0
                    ? BigDecimal.ZERO
                    : priceDiff.divide(lot.getEntryPrice(), PCT_CONTEXT).multiply(HUNDRED);

            state.closedTrades.add(ClosedTrade.builder()
                    .symbol(sell.getSymbol())
                    .quantity(matched)
                    .entryPrice(lot.getEntryPrice())
                    .exitPrice(sell.getFillPrice())
                    .pnl(pnl)
                    .pnlPct(pnlPct)
                    .entryTime(lot.getEntryTime())
                    .exitTime(sell.getTimestamp())
                    .entryConfidence(lot.getConfidence())
                    .strategyName(lot.getStrategyName())
                    .build());

            remaining -= matched;
            lot.setRemainingQuantity(lot.getRemainingQuantity() - matched);
            if (lot.getRemainingQuantity() == 0) {
                queue.pollFirst();
            }
        }

        if (remaining > 0) {
            log.debug("SELL {} left {} unmatched shares", sell.getSymbol(), remaining);
        }
    }

    private static final class MatchState {
        private final Map<String, Deque<Lot>> queues = new HashMap<>();
        private final List<ClosedTrade> closedTrades = new ArrayList<>();
    }
}
