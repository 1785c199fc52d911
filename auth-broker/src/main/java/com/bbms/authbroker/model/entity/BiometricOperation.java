package com.bbms.authbroker.model.entity;

import com.bbms.authbroker.model.CompletionSource;
import com.bbms.authbroker.model.ExpiryReason;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.ProofDecision;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "biometric_operations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BiometricOperation {

    /** Provider-assigned operation (enrollment) or transaction (authentication) id. */
    @Id
    @Column(name = "operation_id", updatable = false, nullable = false, length = 128)
    private String operationId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 20, nullable = false)
    private OperationKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 20, nullable = false)
    private OperationState state;

    /** Raw provider state code last observed. Advisory only. */
    @Column(name = "remote_state", length = 30)
    private String remoteState;

    /** Raw provider result code last observed. Advisory only. */
    @Column(name = "remote_result", length = 30)
    private String remoteResult;

    @Enumerated(EnumType.STRING)
    @Column(name = "completion_source", length = 20)
    private CompletionSource completionSource;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", length = 20)
    private ProofDecision decision;

    /** Comma-separated reject or review reason codes. */
    @Column(name = "reasons", columnDefinition = "TEXT")
    private String reasons;

    @Enumerated(EnumType.STRING)
    @Column(name = "expiry_reason", length = 30)
    private ExpiryReason expiryReason;

    /** Recorded proof, stored as raw JSON. Written at most once. */
    @Column(name = "proof_payload", columnDefinition = "TEXT")
    private String proofPayload;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    /** Presence is the only proof of genuine remote completion. */
    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (updatedAt == null)
            updatedAt = now;
        if (state == null)
            state = OperationState.CREATED;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
