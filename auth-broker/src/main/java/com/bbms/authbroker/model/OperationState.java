package com.bbms.authbroker.model;

/**
 * Local, authoritative lifecycle of a biometric operation.
 * <p>
 * {@code CREATED} and {@code PENDING} are both pre-terminal; {@code CREATED}
 * only marks an operation registered locally before the first remote signal.
 * States only move forward.
 * </p>
 */
public enum OperationState {

    CREATED(0),
    PENDING(1),
    COMPLETED(2),
    FAILED(2),
    EXPIRED(2);

    private final int rank;

    OperationState(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    public boolean canTransitionTo(OperationState next) {
        return !isTerminal() && next.rank > rank;
    }
}
