package com.adaptiverisk.domain.enums;

/** Order type carried on an {@link com.adaptiverisk.domain.model.OrderIntent}. */
public enum OrderType {
    MARKET,
    LIMIT
}
