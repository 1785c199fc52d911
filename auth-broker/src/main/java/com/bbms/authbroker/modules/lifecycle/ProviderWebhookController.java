package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.modules.lifecycle.dto.CaptureEventResponse;
import com.bbms.authbroker.modules.lifecycle.dto.ProviderWebhookEvent;
import com.bbms.authbroker.modules.operation.WebhookSignatureVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Provider webhooks.
 * <ul>
 * <li>POST /webhooks/authid: signed event, routed as a completion signal</li>
 * <li>GET /webhooks/authid/health: reachability check for the provider console</li>
 * </ul>
 * Completion and failure events only prompt the broker to confirm the
 * operation with the provider; the webhook itself never decides an outcome.
 */
@Slf4j
@RestController
@RequestMapping("/webhooks/authid")
@RequiredArgsConstructor
public class ProviderWebhookController {

    static final String SIGNATURE_HEADER = "X-AuthID-Signature";

    private final WebhookSignatureVerifier signatureVerifier;
    private final BiometricOperationService operationService;
    private final SecurityIncidentService securityIncidentService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String payload) {
        if (!signatureVerifier.isValid(payload, signature)) {
            log.warn("Webhook rejected: invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "INVALID_SIGNATURE", "message", "Webhook signature verification failed"));
        }

        ProviderWebhookEvent event;
        try {
            event = objectMapper.readValue(payload, ProviderWebhookEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Webhook rejected: unreadable body: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "INVALID_PAYLOAD", "message", "Webhook body is not a valid event"));
        }
        if (event.getEventType() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "INVALID_PAYLOAD", "message", "event_type is required"));
        }

        log.info("Webhook received: eventType={}", event.getEventType());
        Map<String, Object> body = new HashMap<>();
        body.put("received", true);
        body.put("eventType", event.getEventType());

        switch (event.getEventType()) {
            case ProviderWebhookEvent.ENROLLMENT_COMPLETED ->
                    route(event, OperationKind.ENROLLMENT, true).ifPresent(r -> body.put("ack", r.getAck()));
            case ProviderWebhookEvent.ENROLLMENT_FAILED ->
                    route(event, OperationKind.ENROLLMENT, false).ifPresent(r -> body.put("ack", r.getAck()));
            case ProviderWebhookEvent.VERIFICATION_COMPLETED ->
                    route(event, OperationKind.AUTHENTICATION, true).ifPresent(r -> body.put("ack", r.getAck()));
            case ProviderWebhookEvent.VERIFICATION_FAILED ->
                    route(event, OperationKind.AUTHENTICATION, false).ifPresent(r -> body.put("ack", r.getAck()));
            case ProviderWebhookEvent.SECURITY_ALERT -> securityIncidentService.logSecurityIncident(
                    "PROVIDER_ALERT", userId(event), operationId(event), event.getData());
            case ProviderWebhookEvent.USER_UPDATED ->
                    log.info("Provider account updated: userId={}", event.text("user_id"));
            default -> log.info("Unhandled webhook event: {}", event.getEventType());
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "signatureConfigured", signatureVerifier.isConfigured(),
                "timestamp", OffsetDateTime.now(clock).toString()));
    }

    private Optional<CaptureEventResponse> route(ProviderWebhookEvent event, OperationKind kind, boolean succeeded) {
        return operationService.onProviderNotification(operationId(event), userId(event), kind, succeeded);
    }

    private static String operationId(ProviderWebhookEvent event) {
        return event.firstText("operation_id", "transaction_id", "enrollment_id", "verification_id");
    }

    private static UUID userId(ProviderWebhookEvent event) {
        String value = event.firstText("user_id", "account_number");
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.info("Webhook carries a non-local account reference: {}", value);
            return null;
        }
    }
}
