package com.adaptiverisk.simulator;

import java.util.Optional;

/**
 * Trading rule evaluated once per symbol per backtest step.
 *
 * <p>Implementations must be stateless between calls; everything they need is in the
 * {@link SignalContext}.
 */
public interface SignalStrategy {

    /** Lookup key used by backtest requests, e.g. {@code range_reversal}. */
    String getKey();

    /** Label stamped on the trades this strategy produces. */
    String getDisplayName();

    Optional<TradeSignal> evaluate(SignalContext context);
}
