package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Security incidents: proofs rejected for injection or presentation attack,
 * and alerts raised by the provider.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityIncidentService {

    private final AuditService auditService;

    /**
     * Log a security incident to the audit trail and the error log.
     *
     * @param type        incident type (e.g. "BIOMETRIC_INJECTION_DETECTED")
     * @param userId      the user the operation belongs to
     * @param operationId the operation whose proof raised the incident
     * @param details     reasons and scores
     */
    public void logSecurityIncident(String type, UUID userId, String operationId, Map<String, Object> details) {
        log.error("SECURITY INCIDENT [{}] userId={}, operationId={}, details={}", type, userId, operationId, details);
        auditService.log(userId, "SECURITY_INCIDENT_" + type, operationId, null, details);
    }
}
