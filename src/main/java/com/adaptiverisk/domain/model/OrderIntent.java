package com.adaptiverisk.domain.model;

import com.adaptiverisk.domain.enums.OrderType;
import com.adaptiverisk.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * What the engine asks the brokerage collaborator to do. The engine never speaks
 * a broker wire protocol itself.
 */
@Value
@Builder
public class OrderIntent {

    String symbol;
    TradeSide side;
    int quantity;
    OrderType orderType;

    /** Price the decision was made against; paper fills use it directly. */
    BigDecimal referencePrice;
}
