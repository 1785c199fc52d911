package com.bbms.authbroker.service;

import com.bbms.authbroker.model.entity.AuditLog;
import com.bbms.authbroker.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Records audit trail entries for enrollment, login and session events.
 */
@SuppressWarnings("null")
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId      the user concerned (nullable for system actions)
     * @param action      short action descriptor, e.g. "BIOMETRIC_LOGIN_SUCCESS"
     * @param operationId the biometric operation involved, if any
     * @param ip          client IP address, if known
     * @param metadata    arbitrary key-value metadata (serialized as JSON)
     */
    public void log(UUID userId, String action, String operationId, String ip, Map<String, Object> metadata) {
        String json = null;
        if (metadata != null) {
            try {
                json = objectMapper.writeValueAsString(metadata);
            } catch (JsonProcessingException e) {
                // Keep the entry, lose the metadata
                log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
            }
        }

        auditLogRepository.save(AuditLog.builder()
                .userId(userId)
                .action(action)
                .operationId(operationId)
                .ipAddress(ip)
                .metadata(json)
                .build());
        log.debug("Audit logged: action={}, operationId={}, user={}", action, operationId, userId);
    }
}
