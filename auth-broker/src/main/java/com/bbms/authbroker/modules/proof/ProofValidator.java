package com.bbms.authbroker.modules.proof;

import com.bbms.authbroker.config.ProofPolicyProperties;
import com.bbms.authbroker.model.ProofDecision;
import com.bbms.authbroker.modules.operation.dto.ProofResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a proof as accept, reject or manual review.
 * <ul>
 * <li>Reject: liveness failed, selfie or document injection, presentation
 * attack, expired document, or no proof at all</li>
 * <li>Manual review: no hard fail, but a score under its threshold or a
 * secondary check (barcode, MRZ/OCR, PAD review) disagreeing</li>
 * <li>Accept: otherwise</li>
 * </ul>
 * Pure: the same proof and thresholds always give the same classification.
 * An unreported score is not a finding.
 */
@Component
public class ProofValidator {

    private final double minMatchScore;
    private final double minConfidenceScore;

    @Autowired
    public ProofValidator(ProofPolicyProperties policy) {
        this(policy.getMinMatchScore(), policy.getMinConfidenceScore());
    }

    public ProofValidator(double minMatchScore, double minConfidenceScore) {
        this.minMatchScore = minMatchScore;
        this.minConfidenceScore = minConfidenceScore;
    }

    public ProofValidation validate(ProofResult proof) {
        if (proof == null) {
            return new ProofValidation(ProofDecision.REJECT, List.of(RejectReason.PROOF_MISSING), List.of());
        }

        List<RejectReason> rejects = new ArrayList<>();
        if (Boolean.FALSE.equals(proof.getLivenessPassed())) {
            rejects.add(RejectReason.LIVENESS_FAILED);
        }
        if (proof.isSelfieInjectionDetected()) {
            rejects.add(RejectReason.SELFIE_INJECTION_DETECTED);
        }
        if (proof.isDocumentInjectionDetected()) {
            rejects.add(RejectReason.DOCUMENT_INJECTION_DETECTED);
        }
        if (proof.isPresentationAttackDetected()) {
            rejects.add(RejectReason.PRESENTATION_ATTACK_DETECTED);
        }
        if (proof.isDocumentExpired()) {
            rejects.add(RejectReason.DOCUMENT_EXPIRED);
        }

        List<ReviewReason> reviews = new ArrayList<>();
        if (proof.getMatchScore() != null && proof.getMatchScore() < minMatchScore) {
            reviews.add(ReviewReason.LOW_MATCH_SCORE);
        }
        if (proof.getConfidenceScore() != null && proof.getConfidenceScore() < minConfidenceScore) {
            reviews.add(ReviewReason.LOW_CONFIDENCE_SCORE);
        }
        if (proof.isBarcodeCheckFailed()) {
            reviews.add(ReviewReason.BARCODE_CHECK_FAILED);
        }
        if (proof.isMrzOcrMismatch()) {
            reviews.add(ReviewReason.MRZ_OCR_MISMATCH);
        }
        if (proof.isPresentationReviewRequired()) {
            reviews.add(ReviewReason.PAD_MANUAL_REVIEW);
        }

        ProofDecision decision;
        if (!rejects.isEmpty()) {
            decision = ProofDecision.REJECT;
        } else if (!reviews.isEmpty()) {
            decision = ProofDecision.MANUAL_REVIEW;
        } else {
            decision = ProofDecision.ACCEPT;
        }
        return new ProofValidation(decision, rejects, reviews);
    }
}
