package com.bbms.authbroker.repository;

import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.entity.EnrollmentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EnrollmentRecordRepository extends JpaRepository<EnrollmentRecord, UUID> {

    Optional<EnrollmentRecord> findByOperationId(String operationId);

    Optional<EnrollmentRecord> findFirstByUserIdOrderByCreatedAtDesc(UUID userId);

    boolean existsByUserIdAndStatus(UUID userId, OperationState status);

    @Modifying
    @Transactional
    @Query("DELETE FROM EnrollmentRecord r WHERE r.userId = :userId")
    int deleteAllForUser(UUID userId);
}
