package com.bbms.authbroker.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Credential minted after a verified biometric login.
 */
@Entity
@Table(name = "user_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /** Operation whose verified success minted this session. */
    @Column(name = "operation_id", length = 128)
    private String operationId;

    @Column(name = "access_token", unique = true, nullable = false, length = 512)
    private String accessToken;

    @Column(name = "refresh_token", unique = true, nullable = false, length = 512)
    private String refreshToken;

    @Column(name = "access_expires_at")
    private OffsetDateTime accessExpiresAt;

    @Column(name = "refresh_expires_at")
    private OffsetDateTime refreshExpiresAt;

    /** Set once the credential has been handed to the polling client. */
    @Column(name = "delivered_at")
    private OffsetDateTime deliveredAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_active")
    private OffsetDateTime lastActive;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (lastActive == null)
            lastActive = now;
    }
}
