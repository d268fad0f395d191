package com.adaptiverisk.domain.enums;

/** OHLC field selector for as-of price lookups. */
public enum PriceField {
    OPEN,
    HIGH,
    LOW,
    CLOSE
}
