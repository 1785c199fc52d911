package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.modules.detection.SignalAck;
import com.bbms.authbroker.modules.lifecycle.dto.CaptureEventResponse;
import com.bbms.authbroker.modules.operation.WebhookSignatureVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class ProviderWebhookControllerTest {

    private static final String SIGNATURE = "abc123";

    @Mock
    private WebhookSignatureVerifier signatureVerifier;
    @Mock
    private BiometricOperationService operationService;
    @Mock
    private SecurityIncidentService securityIncidentService;

    private ProviderWebhookController controller;

    @BeforeEach
    void setUp() {
        controller = new ProviderWebhookController(signatureVerifier, operationService, securityIncidentService,
                new ObjectMapper(), Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private ResponseEntity<Map<String, Object>> post(String body) {
        when(signatureVerifier.isValid(body, SIGNATURE)).thenReturn(true);
        return controller.receive(SIGNATURE, body);
    }

    @Test
    @DisplayName("Bad signature → 401 INVALID_SIGNATURE, nothing routed")
    void invalidSignatureRejected() {
        String body = "{\"event_type\":\"verification.completed\",\"data\":{\"transaction_id\":\"tx-1\"}}";
        when(signatureVerifier.isValid(body, "forged")).thenReturn(false);

        ResponseEntity<Map<String, Object>> response = controller.receive("forged", body);

        assertEquals(401, response.getStatusCode().value());
        assertEquals("INVALID_SIGNATURE", response.getBody().get("error"));
        verifyNoInteractions(operationService, securityIncidentService);
    }

    @Test
    @DisplayName("verification.completed with transaction_id → success signal for that operation")
    void verificationCompletedRouted() {
        when(operationService.onProviderNotification("tx-1", null, OperationKind.AUTHENTICATION, true))
                .thenReturn(Optional.of(new CaptureEventResponse("tx-1", SignalAck.ACCEPTED, OperationOutcome.COMPLETED)));

        ResponseEntity<Map<String, Object>> response =
                post("{\"event_type\":\"verification.completed\",\"data\":{\"transaction_id\":\"tx-1\"}}");

        assertEquals(200, response.getStatusCode().value());
        assertEquals(SignalAck.ACCEPTED, response.getBody().get("ack"));
    }

    @Test
    @DisplayName("enrollment.failed with only user_id → failure signal resolved by user and kind")
    void enrollmentFailedByUser() {
        UUID userId = UUID.randomUUID();
        when(operationService.onProviderNotification(null, userId, OperationKind.ENROLLMENT, false))
                .thenReturn(Optional.empty());

        ResponseEntity<Map<String, Object>> response =
                post("{\"event_type\":\"enrollment.failed\",\"data\":{\"user_id\":\"" + userId + "\"}}");

        assertEquals(200, response.getStatusCode().value());
        assertFalse(response.getBody().containsKey("ack"));
        verify(operationService).onProviderNotification(null, userId, OperationKind.ENROLLMENT, false);
    }

    @Test
    @DisplayName("security.alert → security incident, no operation signal")
    void securityAlertLogged() {
        ResponseEntity<Map<String, Object>> response =
                post("{\"event_type\":\"security.alert\",\"data\":{\"operation_id\":\"op-7\",\"alert_type\":\"spoof\"}}");

        assertEquals(200, response.getStatusCode().value());
        verify(securityIncidentService).logSecurityIncident(eq("PROVIDER_ALERT"), isNull(), eq("op-7"),
                argThat(details -> "spoof".equals(details.get("alert_type"))));
        verifyNoInteractions(operationService);
    }

    @Test
    @DisplayName("Unknown event types are acknowledged and ignored")
    void unknownEventIgnored() {
        ResponseEntity<Map<String, Object>> response =
                post("{\"event_type\":\"user.updated\",\"data\":{\"user_id\":\"u-1\"}}");

        assertEquals(200, response.getStatusCode().value());
        assertEquals("user.updated", response.getBody().get("eventType"));
        verifyNoInteractions(operationService, securityIncidentService);
    }

    @Test
    @DisplayName("Signed but malformed body → 400")
    void malformedBodyRejected() {
        assertEquals(400, post("not json").getStatusCode().value());
        assertEquals(400, post("{\"data\":{}}").getStatusCode().value());
        verifyNoInteractions(operationService);
    }
}
