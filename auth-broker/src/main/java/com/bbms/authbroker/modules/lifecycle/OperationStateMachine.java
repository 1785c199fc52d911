package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.CompletionSource;
import com.bbms.authbroker.model.ExpiryReason;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.ProofDecision;
import com.bbms.authbroker.model.entity.BiometricOperation;
import com.bbms.authbroker.model.entity.EnrollmentRecord;
import com.bbms.authbroker.modules.credential.CredentialIssuer;
import com.bbms.authbroker.modules.detection.CompletionListener;
import com.bbms.authbroker.modules.detection.CompletionPredicate;
import com.bbms.authbroker.modules.detection.Detection;
import com.bbms.authbroker.modules.operation.OperationClient;
import com.bbms.authbroker.modules.operation.ProviderUnavailableException;
import com.bbms.authbroker.modules.operation.ResultNotReadyException;
import com.bbms.authbroker.modules.operation.dto.CreatedOperation;
import com.bbms.authbroker.modules.operation.dto.OperationStatus;
import com.bbms.authbroker.modules.operation.dto.ProofResult;
import com.bbms.authbroker.modules.proof.ProofValidation;
import com.bbms.authbroker.modules.proof.ProofValidator;
import com.bbms.authbroker.repository.BiometricOperationRepository;
import com.bbms.authbroker.repository.EnrollmentRecordRepository;
import com.bbms.authbroker.repository.UserRepository;
import com.bbms.authbroker.service.AuditService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The only writer of {@link BiometricOperation} state and of the enrollment
 * records mirroring it.
 * <p>
 * {@code CREATED -> PENDING -> COMPLETED | FAILED | EXPIRED}. Transitions for
 * one operation are serialized on a per-operation lock; operations never
 * share a lock. Applying a detection to a terminal operation changes nothing
 * and returns the existing outcome.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@SuppressWarnings("null")
public class OperationStateMachine implements CompletionListener {

    static final String REMOTE_FAILURE_REASON = "RemoteFailure";

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final BiometricOperationRepository operationRepository;
    private final EnrollmentRecordRepository enrollmentRepository;
    private final UserRepository userRepository;
    private final OperationClient operationClient;
    private final ProofValidator proofValidator;
    private final CredentialIssuer credentialIssuer;
    private final AuditService auditService;
    private final SecurityIncidentService securityIncidentService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ================================================================
    // Registration
    // ================================================================

    /**
     * Record a freshly created remote operation as {@code CREATED}; an
     * enrollment also gets its user-scoped enrollment record.
     */
    public BiometricOperation register(CreatedOperation created, UUID userId, String ip) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        BiometricOperation operation = operationRepository.save(BiometricOperation.builder()
                .operationId(created.operationId())
                .userId(userId)
                .kind(created.kind())
                .state(OperationState.CREATED)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(created.expiresAt())
                .build());

        if (created.kind() == OperationKind.ENROLLMENT) {
            enrollmentRepository.save(EnrollmentRecord.builder()
                    .userId(userId)
                    .operationId(created.operationId())
                    .status(OperationState.CREATED)
                    .createdAt(now)
                    .build());
            auditService.log(userId, "BIOMETRIC_ENROLLMENT_STARTED", created.operationId(), ip, null);
        } else {
            auditService.log(userId, "BIOMETRIC_LOGIN_INITIATED", created.operationId(), ip, null);
        }

        log.info("Operation registered: operationId={}, kind={}, userId={}, expiresAt={}",
                created.operationId(), created.kind(), userId, created.expiresAt());
        return operation;
    }

    /**
     * Drop every enrollment record of a user once their biometric data has
     * been deleted at the provider.
     *
     * @return number of records removed
     */
    public int clearEnrollments(UUID userId, String ip) {
        int removed = enrollmentRepository.deleteAllForUser(userId);
        auditService.log(userId, "BIOMETRIC_DATA_DELETED", null, ip, Map.of("enrollmentRecords", removed));
        log.info("Enrollment records cleared: userId={}, removed={}", userId, removed);
        return removed;
    }

    // ================================================================
    // CompletionListener
    // ================================================================

    @Override
    public void onPending(String operationId, OperationStatus status) {
        ReentrantLock lock = lockFor(operationId);
        lock.lock();
        try {
            operationRepository.findById(operationId).ifPresent(operation -> {
                if (operation.getState() == OperationState.CREATED) {
                    operation.setState(OperationState.PENDING);
                    recordRemote(operation, status);
                    operationRepository.save(operation);
                    mirrorEnrollment(operation);
                    log.info("Operation pending: operationId={}", operationId);
                }
            });
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OperationOutcome onDetection(Detection detection) {
        String operationId = detection.operationId();
        ReentrantLock lock = lockFor(operationId);
        boolean terminal = false;
        lock.lock();
        try {
            BiometricOperation operation = load(operationId);

            if (operation.getState().isTerminal()) {
                terminal = true;
                log.info("Detection on terminal operation ignored: operationId={}, state={}, source={}",
                        operationId, operation.getState(), detection.source());
                return OperationOutcome.of(operation);
            }
            if (operation.getDecision() != null && detection.expiryReason() == null) {
                log.info("Detection on decided operation ignored: operationId={}, decision={}, source={}",
                        operationId, operation.getDecision(), detection.source());
                return OperationOutcome.of(operation);
            }

            if (detection.source() == CompletionSource.POLL) {
                recordRemote(operation, detection.status());
            }
            switch (detection.type()) {
                case COMPLETED -> complete(operation, detection);
                case FAILED -> fail(operation, detection.source(), List.of(REMOTE_FAILURE_REASON));
                case EXPIRED -> expire(operation, detection.source(), detection.expiryReason());
            }
            terminal = operation.getState().isTerminal();
            return OperationOutcome.of(operation);
        } finally {
            lock.unlock();
            if (terminal) {
                locks.remove(operationId, lock);
            }
        }
    }

    @Override
    public boolean isSettled(String operationId) {
        return operationRepository.findById(operationId)
                .map(op -> op.getState().isTerminal() || op.getDecision() == ProofDecision.MANUAL_REVIEW)
                .orElse(false);
    }

    // ================================================================
    // Transitions
    // ================================================================

    /**
     * A completion is only acted on once the provider's own status shows a
     * success with a completion time. Signals that did not come from polling
     * are confirmed against the provider first. While the proof cannot be
     * read the operation stays pending; the detector delivers the completion
     * again on its next tick.
     */
    private void complete(BiometricOperation operation, Detection detection) {
        String operationId = operation.getOperationId();
        OperationStatus status = detection.status();
        if (detection.source() != CompletionSource.POLL) {
            status = operationClient.queryStatus(operationId, operation.getKind());
            recordRemote(operation, status);
            if (CompletionPredicate.isFailed(status)) {
                fail(operation, detection.source(), List.of(REMOTE_FAILURE_REASON));
                return;
            }
            if (!CompletionPredicate.isCompleted(status)) {
                log.warn("Completion signal not confirmed by provider, still pending: operationId={}, source={}, "
                        + "remoteState={}", operationId, detection.source(), status.remoteState());
                return;
            }
        } else if (!CompletionPredicate.isCompleted(status)) {
            log.warn("Completion without success result and CompletedAt rejected, still pending: operationId={}",
                    operationId);
            return;
        }

        ProofResult proof;
        try {
            proof = operationClient.fetchResult(operationId, operation.getKind());
        } catch (ResultNotReadyException | ProviderUnavailableException e) {
            log.warn("Proof not yet available, operation stays pending: operationId={}: {}",
                    operationId, e.getMessage());
            return;
        }
        recordProof(operation, proof);

        ProofValidation validation = proofValidator.validate(proof);
        operation.setDecision(validation.decision());
        operation.setReasons(joinReasons(validation.reasonCodes()));
        operation.setCompletionSource(detection.source());

        switch (validation.decision()) {
            case ACCEPT -> accept(operation, status.completedAt());
            case REJECT -> {
                fail(operation, detection.source(), validation.reasonCodes());
                if (validation.hasAttackIndicator()) {
                    securityIncidentService.logSecurityIncident("BIOMETRIC_ATTACK_DETECTED",
                            operation.getUserId(), operationId,
                            Map.of("reasons", validation.reasonCodes(), "kind", operation.getKind().name()));
                }
            }
            case MANUAL_REVIEW -> {
                operation.setState(OperationState.PENDING);
                operationRepository.save(operation);
                mirrorEnrollment(operation);
                auditService.log(operation.getUserId(), auditAction(operation, "MANUAL_REVIEW"),
                        operationId, null, Map.of("reasons", validation.reasonCodes()));
                log.warn("Operation requires manual review: operationId={}, reasons={}",
                        operationId, validation.reasonCodes());
            }
        }
    }

    private void accept(BiometricOperation operation, OffsetDateTime completedAt) {
        String operationId = operation.getOperationId();
        if (operation.getKind() == OperationKind.AUTHENTICATION) {
            credentialIssuer.issueCredential(operation.getUserId(), operationId);
            userRepository.findById(operation.getUserId()).ifPresent(user -> {
                user.setLastLoginAt(OffsetDateTime.now(clock));
                userRepository.save(user);
            });
        }

        operation.setState(OperationState.COMPLETED);
        operation.setCompletedAt(completedAt);
        operationRepository.save(operation);
        mirrorEnrollment(operation);

        auditService.log(operation.getUserId(), auditAction(operation, "COMPLETED"), operationId, null,
                Map.of("source", operation.getCompletionSource().name()));
        log.info("Operation completed: operationId={}, kind={}, source={}",
                operationId, operation.getKind(), operation.getCompletionSource());
    }

    private void fail(BiometricOperation operation, CompletionSource source, List<String> reasons) {
        operation.setState(OperationState.FAILED);
        operation.setCompletionSource(source);
        operation.setReasons(joinReasons(reasons));
        operationRepository.save(operation);
        mirrorEnrollment(operation);

        auditService.log(operation.getUserId(), auditAction(operation, "FAILED"), operation.getOperationId(),
                null, Map.of("reasons", reasons, "source", source.name()));
        log.warn("Operation failed: operationId={}, kind={}, reasons={}",
                operation.getOperationId(), operation.getKind(), reasons);
    }

    private void expire(BiometricOperation operation, CompletionSource source, ExpiryReason reason) {
        operation.setState(OperationState.EXPIRED);
        operation.setCompletionSource(source);
        operation.setExpiryReason(reason);
        operationRepository.save(operation);
        mirrorEnrollment(operation);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reason", reason != null ? reason.name() : null);
        metadata.put("source", source.name());
        auditService.log(operation.getUserId(), auditAction(operation, "EXPIRED"), operation.getOperationId(),
                null, metadata);
        log.warn("Operation expired: operationId={}, kind={}, reason={}",
                operation.getOperationId(), operation.getKind(), reason);
    }

    // ================================================================
    // Helpers
    // ================================================================

    private BiometricOperation load(String operationId) {
        return operationRepository.findById(operationId)
                .orElseThrow(() -> new OperationNotFoundException(operationId));
    }

    private ReentrantLock lockFor(String operationId) {
        return locks.computeIfAbsent(operationId, id -> new ReentrantLock());
    }

    private void recordRemote(BiometricOperation operation, OperationStatus status) {
        if (status == null) {
            return;
        }
        if (status.remoteState() != null) {
            operation.setRemoteState(status.remoteState().name());
        }
        if (status.resultCode() != null) {
            operation.setRemoteResult(status.resultCode().name());
        }
    }

    /** A recorded proof is never replaced. */
    private void recordProof(BiometricOperation operation, ProofResult proof) {
        if (operation.getProofPayload() != null) {
            return;
        }
        try {
            operation.setProofPayload(objectMapper.writeValueAsString(proof));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize proof for operationId={}: {}", operation.getOperationId(), e.getMessage());
        }
    }

    private void mirrorEnrollment(BiometricOperation operation) {
        if (operation.getKind() != OperationKind.ENROLLMENT) {
            return;
        }
        enrollmentRepository.findByOperationId(operation.getOperationId()).ifPresent(record -> {
            record.setStatus(operation.getState());
            if (operation.getState().isTerminal()) {
                record.setCompletedAt(OffsetDateTime.now(clock));
            }
            enrollmentRepository.save(record);
        });
    }

    private static String auditAction(BiometricOperation operation, String suffix) {
        return (operation.getKind() == OperationKind.ENROLLMENT ? "BIOMETRIC_ENROLLMENT_" : "BIOMETRIC_LOGIN_")
                + suffix;
    }

    private static String joinReasons(List<String> reasons) {
        return reasons == null || reasons.isEmpty() ? null : String.join(",", reasons);
    }
}
