package com.bbms.authbroker.modules.proof;

/**
 * Soft-fail findings that send an otherwise clean proof to manual review.
 */
public enum ReviewReason {
    LOW_MATCH_SCORE("LowMatchScore"),
    LOW_CONFIDENCE_SCORE("LowConfidenceScore"),
    BARCODE_CHECK_FAILED("BarcodeCheckFailed"),
    MRZ_OCR_MISMATCH("MrzOcrMismatch"),
    PAD_MANUAL_REVIEW("PadManualReview");

    private final String code;

    ReviewReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
