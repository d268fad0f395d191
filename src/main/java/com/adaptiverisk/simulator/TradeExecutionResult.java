package com.adaptiverisk.simulator;

import com.adaptiverisk.domain.enums.RejectionReason;
import com.adaptiverisk.domain.model.SimulatedTrade;
import lombok.Getter;

/**
 * Outcome of a trade submitted to the {@link TradeSimulator}: either the executed
 * trade or a typed rejection. Rejections are ordinary results, never exceptions, so a
 * driving loop can log them and carry on.
 */
@Getter
public class TradeExecutionResult {

    private final SimulatedTrade trade;
    private final RejectionReason rejectionReason;
    private final String message;

    private TradeExecutionResult(SimulatedTrade trade, RejectionReason rejectionReason, String message) {
        this.trade = trade;
        this.rejectionReason = rejectionReason;
        this.message = message;
    }

    public static TradeExecutionResult filled(SimulatedTrade trade) {
        return new TradeExecutionResult(trade, null, null);
    }

    public static TradeExecutionResult rejected(RejectionReason reason, String message) {
        return new TradeExecutionResult(null, reason, message);
    }

    public boolean isFilled() {
        return trade != null;
    }

    public boolean isRejected() {
        return trade == null;
    }

    @Override
    public String toString() {
        return isFilled() ? "FILLED " + trade.getTradeId() : "REJECTED " + rejectionReason + ": " + message;
    }
}
