package com.bbms.authbroker.modules.detection;

import com.bbms.authbroker.modules.operation.dto.OperationStatus;
import com.bbms.authbroker.modules.operation.dto.RemoteResult;
import com.bbms.authbroker.modules.operation.dto.RemoteState;

import java.util.Optional;

/**
 * Decides whether one remote observation is terminal.
 * <p>
 * A success is only genuine when the provider reports a success result
 * <b>and</b> a completion timestamp. Freshly created operations can briefly
 * report a success-shaped result with no {@code CompletedAt}; those are
 * still pending.
 * </p>
 */
public final class CompletionPredicate {

    private CompletionPredicate() {
    }

    public static boolean isCompleted(OperationStatus status) {
        return status != null
                && status.resultCode() == RemoteResult.SUCCESS
                && status.completedAt() != null;
    }

    public static boolean isFailed(OperationStatus status) {
        if (status == null) {
            return false;
        }
        return status.remoteState() == RemoteState.FAILED
                || (status.resultCode() == RemoteResult.FAILURE && status.completedAt() != null);
    }

    public static boolean isExpired(OperationStatus status) {
        return status != null && status.remoteState() == RemoteState.EXPIRED;
    }

    /** Success-shaped but missing its completion timestamp. */
    public static boolean isPrematureSuccess(OperationStatus status) {
        return status != null
                && status.resultCode() == RemoteResult.SUCCESS
                && status.completedAt() == null;
    }

    /**
     * @return the terminal type this observation proves, or empty while pending
     */
    public static Optional<DetectionType> classify(OperationStatus status) {
        if (isCompleted(status)) {
            return Optional.of(DetectionType.COMPLETED);
        }
        if (isFailed(status)) {
            return Optional.of(DetectionType.FAILED);
        }
        if (isExpired(status)) {
            return Optional.of(DetectionType.EXPIRED);
        }
        return Optional.empty();
    }
}
