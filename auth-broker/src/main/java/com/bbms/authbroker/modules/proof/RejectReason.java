package com.bbms.authbroker.modules.proof;

/**
 * Hard-fail findings. Any one of them rejects the proof.
 */
public enum RejectReason {
    LIVENESS_FAILED("LivenessFailed"),
    SELFIE_INJECTION_DETECTED("SelfieInjectionDetected"),
    DOCUMENT_INJECTION_DETECTED("DocumentInjectionDetected"),
    PRESENTATION_ATTACK_DETECTED("PresentationAttackDetected"),
    DOCUMENT_EXPIRED("DocumentExpired"),
    PROOF_MISSING("ProofMissing");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Findings that indicate an attack rather than a bad capture. */
    public boolean isAttackIndicator() {
        return this == SELFIE_INJECTION_DETECTED
                || this == DOCUMENT_INJECTION_DETECTED
                || this == PRESENTATION_ATTACK_DETECTED;
    }
}
