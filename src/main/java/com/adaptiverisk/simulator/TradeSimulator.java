package com.adaptiverisk.simulator;

import com.adaptiverisk.domain.enums.PriceField;
import com.adaptiverisk.domain.enums.RejectionReason;
import com.adaptiverisk.domain.enums.TradeSide;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.adaptiverisk.exception.DataUnavailableException;
import com.adaptiverisk.timeseries.PriceSeriesCache;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes trades against a {@link PositionLedger} with a slippage and commission model.
 *
 * <p>Buys fill at {@code close * (1 + slippageRate)}, sells at {@code close * (1 - slippageRate)},
 * and every trade pays a flat commission. A buy is rejected when
 * {@code fillPrice * quantity + commission} exceeds cash; a sell is rejected when fewer
 * shares are held than requested. Each accepted trade is appended to an immutable,
 * append-only trade stream.
 *
 * <p>The price lookup, the ledger check and the ledger mutation for one trade run inside
 * the ledger's lock, so concurrent callers are serialized per ledger.
 */
public class TradeSimulator {

    private static final Logger log = LoggerFactory.getLogger(TradeSimulator.class);

    private final PriceSeriesCache priceSeriesCache;
    private final PositionLedger positionLedger;
    private final BigDecimal slippageRate;
    private final BigDecimal commission;

    /** Append-only trade stream. Guarded by the ledger lock. */
    private final List<SimulatedTrade> trades = new ArrayList<>();

    public TradeSimulator(
            PriceSeriesCache priceSeriesCache,
            PositionLedger positionLedger,
            BigDecimal slippageRate,
            BigDecimal commission) {
        this.priceSeriesCache = priceSeriesCache;
        this.positionLedger = positionLedger;
        this.slippageRate = slippageRate;
        this.commission = commission;
    }

    /**
     * Simulates a trade at the as-of close price for {@code timestamp}.
     *
     * @return the executed trade, or a rejection (data unavailable, insufficient funds/shares)
     */
    public TradeExecutionResult execute(
            String symbol,
            TradeSide side,
            int quantity,
            LocalDateTime timestamp,
            BigDecimal confidence,
            String strategyName,
            String rationale) {
        return positionLedger.withLock(() -> {
            BigDecimal price;
            try {
                price = priceSeriesCache.priceAt(symbol, timestamp, PriceField.CLOSE);
            } catch (DataUnavailableException e) {
                log.warn("Skipping {} {} x{}: {}", side, symbol, quantity, e.getMessage());
                return TradeExecutionResult.rejected(RejectionReason.DATA_UNAVAILABLE, e.getMessage());
            }
            BigDecimal fillPrice = applySlippage(price, side);
            return settle(symbol, side, quantity, fillPrice, timestamp, confidence, strategyName, rationale);
        });
    }

    /**
     * Books a fill whose price was set externally (a broker fill in live mode). No slippage
     * is applied; commission and ledger constraints are.
     */
    public TradeExecutionResult recordFill(
            String symbol,
            TradeSide side,
            int quantity,
            BigDecimal fillPrice,
            LocalDateTime timestamp,
            BigDecimal confidence,
            String strategyName,
            String rationale) {
        return positionLedger.withLock(
                () -> settle(symbol, side, quantity, fillPrice, timestamp, confidence, strategyName, rationale));
    }

    BigDecimal applySlippage(BigDecimal price, TradeSide side) {
        BigDecimal factor = side == TradeSide.BUY ? BigDecimal.ONE.add(slippageRate) : BigDecimal.ONE.subtract(slippageRate);
        return price.multiply(factor);
    }

    private TradeExecutionResult settle(
            String symbol,
            TradeSide side,
            int quantity,
            BigDecimal fillPrice,
            LocalDateTime timestamp,
            BigDecimal confidence,
            String strategyName,
            String rationale) {
        if (quantity <= 0) {
            return TradeExecutionResult.rejected(
                    RejectionReason.INVALID_QUANTITY, "Quantity must be positive: " + quantity);
        }

        BigDecimal grossValue = fillPrice.multiply(BigDecimal.valueOf(quantity));
        BigDecimal netValue;

        if (side == TradeSide.BUY) {
            netValue = grossValue.add(commission);
            BigDecimal cash = positionLedger.getCash();
            if (netValue.compareTo(cash) > 0) {
                log.warn("Rejected BUY {} x{}: cost {} exceeds cash {}", symbol, quantity, netValue, cash);
                return TradeExecutionResult.rejected(
                        RejectionReason.INSUFFICIENT_FUNDS, "Cost " + netValue + " exceeds cash " + cash);
            }
            positionLedger.debitCash(netValue);
            positionLedger.addShares(symbol, quantity);
        } else {
            int held = positionLedger.quantity(symbol);
            if (held < quantity) {
                log.warn("Rejected SELL {} x{}: only {} held", symbol, quantity, held);
                return TradeExecutionResult.rejected(
                        RejectionReason.INSUFFICIENT_SHARES, "Requested " + quantity + " but holding " + held);
            }
            netValue = grossValue.subtract(commission);
            if (positionLedger.getCash().add(netValue).signum() < 0) {
                return TradeExecutionResult.rejected(
                        RejectionReason.INSUFFICIENT_FUNDS, "Commission " + commission + " exceeds available cash");
            }
            positionLedger.creditCash(netValue);
            positionLedger.removeShares(symbol, quantity);
        }

        SimulatedTrade trade = SimulatedTrade.builder()
                .tradeId(UUID.randomUUID().toString())
                .timestamp(timestamp)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .fillPrice(fillPrice)
                .grossValue(grossValue)
                .commission(commission)
                .netValue(netValue)
                .confidence(confidence)
                .strategyName(strategyName)
                .rationale(rationale)
                .cashAfter(positionLedger.getCash())
                .build();
        trades.add(trade);

        log.debug("{} {} x{} @ {} (cash now {})", side, symbol, quantity, fillPrice, trade.getCashAfter());
        return TradeExecutionResult.filled(trade);
    }

    /** Copy of the trade stream in execution order. */
    public List<SimulatedTrade> getTrades() {
        return positionLedger.withLock(() -> List.copyOf(trades));
    }

    public PositionLedger getPositionLedger() {
        return positionLedger;
    }

    public PriceSeriesCache getPriceSeriesCache() {
        return priceSeriesCache;
    }
}
