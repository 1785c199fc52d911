package com.bbms.authbroker.modules.proof;

import com.bbms.authbroker.model.ProofDecision;

import java.util.List;
import java.util.stream.Stream;

/**
 * Classification of one proof, with every finding that contributed to it.
 * Review reasons are reported even when the proof is rejected.
 */
public record ProofValidation(
        ProofDecision decision,
        List<RejectReason> rejectReasons,
        List<ReviewReason> reviewReasons) {

    public ProofValidation {
        rejectReasons = List.copyOf(rejectReasons);
        reviewReasons = List.copyOf(reviewReasons);
    }

    /** Codes of the findings that decided the outcome. */
    public List<String> reasonCodes() {
        return switch (decision) {
            case ACCEPT -> List.of();
            case REJECT -> rejectReasons.stream().map(RejectReason::getCode).toList();
            case MANUAL_REVIEW -> reviewReasons.stream().map(ReviewReason::getCode).toList();
        };
    }

    /** Every finding, reject codes first. */
    public List<String> allCodes() {
        return Stream.concat(
                rejectReasons.stream().map(RejectReason::getCode),
                reviewReasons.stream().map(ReviewReason::getCode))
                .toList();
    }

    public boolean hasAttackIndicator() {
        return rejectReasons.stream().anyMatch(RejectReason::isAttackIndicator);
    }
}
