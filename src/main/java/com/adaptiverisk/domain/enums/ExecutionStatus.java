package com.adaptiverisk.domain.enums;

/** Status reported back by the brokerage collaborator for a submitted intent. */
public enum ExecutionStatus {
    FILLED,
    REJECTED
}
