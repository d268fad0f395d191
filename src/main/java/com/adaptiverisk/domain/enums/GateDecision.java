package com.adaptiverisk.domain.enums;

/**
 * Outcome of the auto-execution gate for a proposed trade.
 *
 * <p>DENY is a hard block (risk limits), REQUIRE_APPROVAL is a soft block that
 * parks the trade until someone approves it manually.
 */
public enum GateDecision {

    /** Trade proceeds without human approval. */
    ALLOW,

    /** Trade is blocked outright, regardless of confidence. */
    DENY,

    /** Confidence is below the effective threshold; manual approval needed. */
    REQUIRE_APPROVAL
}
