package com.adaptiverisk.domain.enums;

/** Final state of a live trade request. */
public enum DecisionStatus {
    /** Filled by the broker and settled on the ledger. */
    EXECUTED,
    /** Refused by the broker or the ledger, or sized to zero. */
    REJECTED,
    /** Stopped by the daily-loss circuit breaker. */
    BLOCKED,
    /** Parked until someone approves or rejects it. */
    PENDING_APPROVAL,
    /** A parked request that was rejected by the approver. */
    DISCARDED
}
