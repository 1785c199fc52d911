package com.bbms.authbroker.modules.operation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Proof payload returned once an operation reaches a terminal remote state.
 * Immutable.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class ProofResult {

    /** Null when the provider did not report liveness. */
    private final Boolean livenessPassed;
    private final boolean selfieInjectionDetected;
    private final boolean documentInjectionDetected;
    private final boolean presentationAttackDetected;
    private final boolean presentationReviewRequired;
    private final boolean documentExpired;
    private final boolean barcodeCheckFailed;
    private final boolean mrzOcrMismatch;
    /** 0-1, null when not reported. */
    private final Double matchScore;
    /** 0-1, null when not reported. */
    private final Double confidenceScore;

    public boolean isInjectionDetected() {
        return selfieInjectionDetected || documentInjectionDetected;
    }

    /**
     * Map the provider's result document onto a proof.
     *
     * @param body the raw result body
     * @return the parsed proof
     */
    public static ProofResult fromProvider(Map<String, Object> body) {
        return ProofResult.builder()
                .livenessPassed(body.get("IsLive") instanceof Boolean live ? live : null)
                .selfieInjectionDetected(isFailing(body.get("SelfieInjectionDetection")))
                .documentInjectionDetected(isFailing(body.get("DocumentInjectionDetection")))
                .presentationAttackDetected("Reject".equals(body.get("PadResult")))
                .presentationReviewRequired("Manual Review".equals(body.get("PadResult")))
                .documentExpired(Boolean.TRUE.equals(body.get("DocumentExpired")))
                .barcodeCheckFailed("Fail".equals(body.get("BarcodeSecurityCheck")))
                .mrzOcrMismatch("Fail".equals(body.get("MRZOCRMismatch")))
                .matchScore(toDouble(body.get("FaceMatchScore")))
                .confidenceScore(toDouble(body.get("ConfidenceScore")))
                .build();
    }

    private static boolean isFailing(Object check) {
        return "Fail".equals(check) || "Reject".equals(check);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
