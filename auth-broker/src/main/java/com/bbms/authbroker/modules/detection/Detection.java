package com.bbms.authbroker.modules.detection;

import com.bbms.authbroker.model.CompletionSource;
import com.bbms.authbroker.model.ExpiryReason;
import com.bbms.authbroker.modules.operation.dto.OperationStatus;

/**
 * A terminal decision proposed by the {@link CompletionDetector}. The state
 * machine accepts or rejects it.
 *
 * @param operationId  the operation concerned
 * @param type         what the detector concluded
 * @param source       which signal produced the conclusion
 * @param status       the observation behind it; null for local expiry
 * @param expiryReason set only for {@link DetectionType#EXPIRED}
 */
public record Detection(
        String operationId,
        DetectionType type,
        CompletionSource source,
        OperationStatus status,
        ExpiryReason expiryReason) {

    public static Detection completed(String operationId, CompletionSource source, OperationStatus status) {
        return new Detection(operationId, DetectionType.COMPLETED, source, status, null);
    }

    public static Detection failed(String operationId, CompletionSource source, OperationStatus status) {
        return new Detection(operationId, DetectionType.FAILED, source, status, null);
    }

    public static Detection expired(String operationId, CompletionSource source, ExpiryReason reason) {
        return new Detection(operationId, DetectionType.EXPIRED, source, null, reason);
    }
}
