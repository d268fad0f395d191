package com.adaptiverisk.api.dto.request;

import com.adaptiverisk.domain.enums.OrderType;
import com.adaptiverisk.domain.enums.TradeSide;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

/**
 * A live trade decision submitted to the engine.
 *
 * <p>Quantity is optional: a buy without one is sized by the position sizer, a sell
 * without one closes the whole position.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private TradeSide side;

    @Positive
    private Integer quantity;

    /** Price the decision was made at; used for sizing and as the paper fill price. */
    @NotNull
    @Positive
    private BigDecimal price;

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal confidence;

    private String strategyName;

    private String rationale;

    private OrderType orderType = OrderType.MARKET;
}
