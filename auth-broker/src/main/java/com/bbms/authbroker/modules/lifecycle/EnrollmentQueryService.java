package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.entity.EnrollmentRecord;
import com.bbms.authbroker.modules.lifecycle.dto.EnrollmentStatusResponse;
import com.bbms.authbroker.repository.EnrollmentRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Read-only view of enrollment records. Writes go through
 * {@link OperationStateMachine}.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EnrollmentQueryService {

    private final EnrollmentRecordRepository enrollmentRepository;

    public boolean isEnrolled(UUID userId) {
        return enrollmentRepository.existsByUserIdAndStatus(userId, OperationState.COMPLETED);
    }

    /**
     * Enrollment status of a user: whether any enrollment completed, plus the
     * latest attempt.
     */
    public EnrollmentStatusResponse status(UUID userId) {
        boolean enrolled = isEnrolled(userId);
        return enrollmentRepository.findFirstByUserIdOrderByCreatedAtDesc(userId)
                .map(latest -> toResponse(enrolled, latest))
                .orElseGet(() -> EnrollmentStatusResponse.builder().enrolled(false).build());
    }

    private static EnrollmentStatusResponse toResponse(boolean enrolled, EnrollmentRecord record) {
        return EnrollmentStatusResponse.builder()
                .enrolled(enrolled)
                .operationId(record.getOperationId())
                .status(record.getStatus())
                .createdAt(record.getCreatedAt())
                .completedAt(record.getCompletedAt())
                .build();
    }
}
