package com.bbms.authbroker.model;

/**
 * Why an operation ended up {@link OperationState#EXPIRED}.
 */
public enum ExpiryReason {
    /** Polling budget ran out without a terminal signal. */
    BUDGET_EXHAUSTED,
    /** Provider reported the operation expired, or its expiresAt passed. */
    OPERATION_EXPIRED,
    /** Completion was detected but the proof never became fetchable. */
    PROOF_UNAVAILABLE,
    /** Caller cancelled the operation. */
    CANCELLED
}
