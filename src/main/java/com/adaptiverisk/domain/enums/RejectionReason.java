package com.adaptiverisk.domain.enums;

/** Why the trade simulator refused to execute a trade. */
public enum RejectionReason {
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_SHARES,
    DATA_UNAVAILABLE,
    INVALID_QUANTITY
}
