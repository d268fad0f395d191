package com.adaptiverisk.simulator;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Authoritative cash balance and per-symbol share counts.
 *
 * <p>Only {@link TradeSimulator} mutates the ledger. All reads and writes go through a
 * single {@link ReentrantLock}, so a funds check and the debit that follows it form one
 * critical section: two concurrent buys can never both pass the check against the same
 * cash balance. Cash never goes negative and a symbol is removed as soon as its share
 * count reaches exactly zero.
 */
public class PositionLedger {

    private final ReentrantLock lock = new ReentrantLock();

    private BigDecimal cash;
    private final Map<String, Integer> quantities = new HashMap<>();

    public PositionLedger(BigDecimal initialCash) {
        if (initialCash == null || initialCash.signum() < 0) {
            throw new IllegalArgumentException("Initial cash must be non-negative: " + initialCash);
        }
        this.cash = initialCash;
    }

    public BigDecimal getCash() {
        return withLock(() -> cash);
    }

    /** Shares held for the symbol; 0 when not held. */
    public int quantity(String symbol) {
        return withLock(() -> quantities.getOrDefault(symbol, 0));
    }

    /** Snapshot of all held symbols and their share counts. */
    public Map<String, Integer> holdings() {
        return withLock(() -> Map.copyOf(quantities));
    }

    /**
     * Cash plus {@code quantity * last known price} for every held symbol. Symbols whose
     * price the lookup cannot provide are skipped rather than failing the valuation.
     */
    public BigDecimal portfolioValue(Function<String, Optional<BigDecimal>> priceLookup) {
        return withLock(() -> cash.add(positionsValue(priceLookup)));
    }

    /** Market value of held positions only, same skipping rule as {@link #portfolioValue}. */
    public BigDecimal positionsValue(Function<String, Optional<BigDecimal>> priceLookup) {
        return withLock(() -> {
            BigDecimal total = BigDecimal.ZERO;
            for (Map.Entry<String, Integer> entry : quantities.entrySet()) {
                Optional<BigDecimal> price = priceLookup.apply(entry.getKey());
                if (price.isPresent()) {
                    total = total.add(price.get().multiply(BigDecimal.valueOf(entry.getValue())));
                }
            }
            return total;
        });
    }

    // ---- Mutations, only reachable from TradeSimulator while holding the lock ----

    <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void debitCash(BigDecimal amount) {
        BigDecimal updated = cash.subtract(amount);
        if (updated.signum() < 0) {
            throw new IllegalStateException("Ledger cash would go negative: " + updated);
        }
        cash = updated;
    }

    void creditCash(BigDecimal amount) {
        cash = cash.add(amount);
    }

    void addShares(String symbol, int quantity) {
        quantities.merge(symbol, quantity, Integer::sum);
    }

    void removeShares(String symbol, int quantity) {
        int remaining = quantities.getOrDefault(symbol, 0) - quantity;
        if (remaining < 0) {
            throw new IllegalStateException("Ledger quantity for " + symbol + " would go negative: " + remaining);
        }
        if (remaining == 0) {
            quantities.remove(symbol);
        } else {
            quantities.put(symbol, remaining);
        }
    }
}
