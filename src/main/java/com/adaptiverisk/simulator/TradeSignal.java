package com.adaptiverisk.simulator;

import com.adaptiverisk.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A strategy's request to trade at the current backtest step. */
@Value
@Builder
public class TradeSignal {

    TradeSide side;
    int quantity;
    BigDecimal confidence;
    String rationale;
}
