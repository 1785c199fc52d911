package com.bbms.authbroker.model;

import com.bbms.authbroker.model.entity.BiometricOperation;

/**
 * Caller-facing view of where an operation stands. Differs from
 * {@link OperationState} only in surfacing {@link #MANUAL_REVIEW}, which is
 * still {@code PENDING} locally but must not be polled forever.
 */
public enum OperationOutcome {
    PENDING,
    MANUAL_REVIEW,
    COMPLETED,
    FAILED,
    EXPIRED;

    public static OperationOutcome of(BiometricOperation operation) {
        return switch (operation.getState()) {
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case EXPIRED -> EXPIRED;
            case CREATED, PENDING -> operation.getDecision() == ProofDecision.MANUAL_REVIEW
                    ? MANUAL_REVIEW
                    : PENDING;
        };
    }

    public boolean isFinal() {
        return this != PENDING;
    }
}
