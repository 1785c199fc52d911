package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.config.ProviderProperties;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.entity.BiometricOperation;
import com.bbms.authbroker.model.entity.User;
import com.bbms.authbroker.modules.credential.CredentialIssuer;
import com.bbms.authbroker.modules.credential.dto.IssuedCredential;
import com.bbms.authbroker.modules.detection.CompletionDetector;
import com.bbms.authbroker.modules.detection.SignalAck;
import com.bbms.authbroker.modules.detection.dto.CaptureEvent;
import com.bbms.authbroker.modules.lifecycle.dto.CaptureEventResponse;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStartResponse;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStatusResponse;
import com.bbms.authbroker.modules.operation.InvalidSubjectException;
import com.bbms.authbroker.modules.operation.OperationClient;
import com.bbms.authbroker.modules.operation.dto.CreatedOperation;
import com.bbms.authbroker.repository.BiometricOperationRepository;
import com.bbms.authbroker.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for controllers: starts operations, reports their status and
 * routes capture-surface events. Never writes operation state itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@SuppressWarnings("null")
public class BiometricOperationService {

    private final OperationClient operationClient;
    private final OperationStateMachine stateMachine;
    private final CompletionDetector completionDetector;
    private final CredentialIssuer credentialIssuer;
    private final EnrollmentQueryService enrollmentQueryService;
    private final BiometricOperationRepository operationRepository;
    private final UserRepository userRepository;
    private final ProviderProperties providerProperties;

    // ================================================================
    // Start
    // ================================================================

    /**
     * Start an enrollment for the session user.
     *
     * @param reEnroll allow replacing an existing completed enrollment
     * @throws AlreadyEnrolledException when enrolled and {@code reEnroll} is false
     */
    public OperationStartResponse startEnrollment(User user, boolean reEnroll, String ip) {
        if (!user.isActiveAccount()) {
            throw new InvalidSubjectException("User account is inactive");
        }
        if (!reEnroll && enrollmentQueryService.isEnrolled(user.getId())) {
            throw new AlreadyEnrolledException(user.getId());
        }

        CreatedOperation created = operationClient.createOperation(OperationKind.ENROLLMENT, user.getId().toString());
        return start(created, user.getId(), ip);
    }

    /**
     * Start a biometric login for an enrolled, active account.
     *
     * @param accountNumber the user id the account was enrolled under
     */
    public OperationStartResponse startAuthentication(String accountNumber, String ip) {
        User user = resolveAccount(accountNumber);
        if (!user.isActiveAccount()) {
            throw new InvalidSubjectException("User account is inactive");
        }
        if (!enrollmentQueryService.isEnrolled(user.getId())) {
            throw new InvalidSubjectException("No completed biometric enrollment for this account");
        }

        CreatedOperation created = operationClient.createOperation(OperationKind.AUTHENTICATION, accountNumber);
        return start(created, user.getId(), ip);
    }

    private OperationStartResponse start(CreatedOperation created, UUID userId, String ip) {
        stateMachine.register(created, userId, ip);
        completionDetector.watch(created.operationId(), created.kind(), created.expiresAt());
        return new OperationStartResponse(created.operationId(), created.kind(),
                captureUrl(created), created.expiresAt());
    }

    // ================================================================
    // Status
    // ================================================================

    /**
     * Status of an operation. For a completed authentication the credential
     * is attached to the first call only.
     */
    public OperationStatusResponse loginStatus(String operationId) {
        BiometricOperation operation = load(operationId);
        if (operation.getKind() != OperationKind.AUTHENTICATION) {
            throw new OperationNotFoundException(operationId);
        }
        OperationOutcome outcome = OperationOutcome.of(operation);
        IssuedCredential credential = outcome == OperationOutcome.COMPLETED
                ? credentialIssuer.claim(operationId).orElse(null)
                : null;
        return toResponse(operation, credential);
    }

    /** Status without credential delivery. */
    public OperationStatusResponse status(String operationId) {
        return toResponse(load(operationId), null);
    }

    // ================================================================
    // Capture surface
    // ================================================================

    public CaptureEventResponse onCaptureEvent(String operationId, CaptureEvent event) {
        load(operationId);
        SignalAck ack = completionDetector.onCaptureEvent(operationId, event);
        return afterSignal(operationId, ack);
    }

    /**
     * Route a verified provider webhook. The operation is named by id, or
     * else found as the user's latest undecided operation of that kind.
     * Operations this broker never started are not an error; the provider
     * notifies for its whole tenant.
     *
     * @return empty when no matching operation is known here
     */
    public Optional<CaptureEventResponse> onProviderNotification(String operationId, UUID userId,
            OperationKind kind, boolean succeeded) {
        Optional<BiometricOperation> operation = operationId != null
                ? operationRepository.findById(operationId)
                : Optional.empty();
        if (operation.isEmpty() && operationId == null && userId != null) {
            operation = operationRepository.findFirstByUserIdAndKindAndStateInOrderByCreatedAtDesc(
                    userId, kind, List.of(OperationState.CREATED, OperationState.PENDING));
        }
        if (operation.isEmpty()) {
            log.info("Provider notification matched no operation: operationId={}, userId={}, kind={}",
                    operationId, userId, kind);
            return Optional.empty();
        }

        String id = operation.get().getOperationId();
        SignalAck ack = completionDetector.onProviderNotification(id, succeeded);
        return Optional.of(afterSignal(id, ack));
    }

    public OperationStatusResponse cancel(String operationId) {
        load(operationId);
        SignalAck ack = completionDetector.cancel(operationId);
        log.info("Cancel requested: operationId={}, ack={}", operationId, ack);
        return status(operationId);
    }

    // ================================================================
    // Biometric data
    // ================================================================

    /**
     * Delete the user's biometric data: enrollments still in flight are
     * cancelled, the provider account goes, and the local enrollment records
     * with it. Authentication history stays for the audit trail.
     *
     * @return number of enrollment records removed
     */
    public int deleteBiometricData(User user, String ip) {
        List<BiometricOperation> inFlight = operationRepository.findByUserIdAndKindAndStateIn(
                user.getId(), OperationKind.ENROLLMENT, List.of(OperationState.CREATED, OperationState.PENDING));
        for (BiometricOperation operation : inFlight) {
            SignalAck ack = completionDetector.cancel(operation.getOperationId());
            log.info("Enrollment cancelled for data deletion: operationId={}, ack={}", operation.getOperationId(), ack);
        }

        operationClient.deleteAccount(user.getId().toString());
        return stateMachine.clearEnrollments(user.getId(), ip);
    }

    // ================================================================
    // Helpers
    // ================================================================

    /**
     * A signal accepted for an operation nobody polls may leave it undecided,
     * e.g. when the proof is not readable yet. Polling resumes in that case.
     */
    private CaptureEventResponse afterSignal(String operationId, SignalAck ack) {
        BiometricOperation operation = load(operationId);
        OperationOutcome outcome = OperationOutcome.of(operation);
        if (ack == SignalAck.ACCEPTED && outcome == OperationOutcome.PENDING
                && !completionDetector.isWatching(operationId)) {
            log.info("Signal left operation undecided, resuming polling: operationId={}", operationId);
            completionDetector.watch(operationId, operation.getKind(), operation.getExpiresAt());
        }
        return new CaptureEventResponse(operationId, ack, outcome);
    }

    private BiometricOperation load(String operationId) {
        return operationRepository.findById(operationId)
                .orElseThrow(() -> new OperationNotFoundException(operationId));
    }

    private User resolveAccount(String accountNumber) {
        UUID userId;
        try {
            userId = UUID.fromString(accountNumber.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidSubjectException("Unknown account: " + accountNumber);
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new InvalidSubjectException("Unknown account: " + accountNumber));
    }

    private String captureUrl(CreatedOperation created) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromUriString(providerProperties.getCaptureWebUrl())
                .queryParam("operationId", created.operationId())
                .queryParam("secret", created.secret())
                .queryParam("baseUrl", providerProperties.getHostUrl());
        if (created.kind() == OperationKind.AUTHENTICATION) {
            builder.queryParam("mode", "authentication");
        }
        return builder.encode().build().toUriString();
    }

    private static OperationStatusResponse toResponse(BiometricOperation operation, IssuedCredential credential) {
        List<String> reasons = operation.getReasons() != null
                ? Arrays.asList(operation.getReasons().split(","))
                : List.of();
        return OperationStatusResponse.builder()
                .operationId(operation.getOperationId())
                .kind(operation.getKind())
                .status(OperationOutcome.of(operation))
                .reasons(reasons)
                .expiryReason(operation.getExpiryReason())
                .completedAt(operation.getCompletedAt())
                .expiresAt(operation.getExpiresAt())
                .credential(credential)
                .build();
    }
}
