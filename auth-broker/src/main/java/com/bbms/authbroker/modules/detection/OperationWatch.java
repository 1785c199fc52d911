package com.bbms.authbroker.modules.detection;

import com.bbms.authbroker.model.OperationKind;

import java.time.OffsetDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polling state of one in-flight operation. Every field is guarded by
 * {@link #lock}.
 */
class OperationWatch {

    final String operationId;
    final OperationKind kind;
    /** Wall-clock end of the polling budget. */
    final OffsetDateTime budgetEnd;
    /** Provider-side expiry of the operation itself; may be null. */
    final OffsetDateTime expiresAt;
    final ReentrantLock lock = new ReentrantLock();

    int attempts;
    boolean pendingReported;
    /** A provider-confirmed completion was seen but its proof could not be read yet. */
    boolean proofPending;
    boolean closed;
    ScheduledFuture<?> future;

    OperationWatch(String operationId, OperationKind kind, OffsetDateTime budgetEnd, OffsetDateTime expiresAt) {
        this.operationId = operationId;
        this.kind = kind;
        this.budgetEnd = budgetEnd;
        this.expiresAt = expiresAt;
    }
}
