package com.bbms.authbroker.repository;

import com.bbms.authbroker.model.entity.UserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findByAccessToken(String accessToken);

    Optional<UserSession> findByRefreshToken(String refreshToken);

    Optional<UserSession> findByOperationId(String operationId);

    /**
     * Mark the credential of an operation as handed out.
     *
     * @return 1 for the caller that won the delivery, 0 for everyone else
     */
    @Modifying
    @Transactional
    @Query("UPDATE UserSession s SET s.deliveredAt = :deliveredAt " +
            "WHERE s.operationId = :operationId AND s.deliveredAt IS NULL")
    int markDelivered(String operationId, OffsetDateTime deliveredAt);

    @Modifying
    @Transactional
    @Query("UPDATE UserSession s SET s.lastActive = CURRENT_TIMESTAMP WHERE s.id = :sessionId")
    void updateLastActive(UUID sessionId);
}
