package com.bbms.authbroker.modules.detection;

import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.modules.operation.dto.OperationStatus;

/**
 * Receives what the {@link CompletionDetector} observes. Implemented by the
 * operation state machine, the only writer of operation state.
 */
public interface CompletionListener {

    /**
     * First observation of an operation that the provider knows about but
     * has not finished.
     */
    void onPending(String operationId, OperationStatus status);

    /**
     * A terminal decision. Must be idempotent.
     *
     * @return the outcome after the detection was applied
     */
    OperationOutcome onDetection(Detection detection);

    /**
     * Whether the operation is already terminal or parked in manual review.
     */
    boolean isSettled(String operationId);
}
