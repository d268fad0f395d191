package com.adaptiverisk.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/** Buy or sell side of a simulated or live trade. */
public enum TradeSide {
    BUY,
    SELL;

    /** Parses "buy"/"sell" in any case. */
    @JsonCreator
    public static TradeSide fromLabel(String label) {
        return TradeSide.valueOf(label.trim().toUpperCase());
    }
}
