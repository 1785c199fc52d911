package com.bbms.authbroker.repository;

import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.entity.BiometricOperation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BiometricOperationRepository extends JpaRepository<BiometricOperation, String> {

    /**
     * Pre-terminal operations past their expiry that are not parked in manual
     * review.
     */
    @Query("SELECT op FROM BiometricOperation op " +
            "WHERE op.state IN :states AND op.expiresAt < :now AND op.decision IS NULL")
    List<BiometricOperation> findStale(Collection<OperationState> states, OffsetDateTime now);

    List<BiometricOperation> findByUserIdAndKindAndStateIn(UUID userId, OperationKind kind,
            Collection<OperationState> states);

    Optional<BiometricOperation> findFirstByUserIdAndKindAndStateInOrderByCreatedAtDesc(UUID userId,
            OperationKind kind, Collection<OperationState> states);
}
