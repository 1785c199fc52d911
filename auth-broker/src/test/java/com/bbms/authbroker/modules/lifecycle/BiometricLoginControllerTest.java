package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.ExpiryReason;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.modules.credential.dto.IssuedCredential;
import com.bbms.authbroker.modules.lifecycle.dto.OperationStatusResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BiometricLoginControllerTest {

    @Mock
    private BiometricOperationService operationService;

    @InjectMocks
    private BiometricLoginController controller;

    private void givenStatus(OperationOutcome outcome, IssuedCredential credential, ExpiryReason expiryReason) {
        when(operationService.loginStatus("tx-1")).thenReturn(OperationStatusResponse.builder()
                .operationId("tx-1")
                .kind(OperationKind.AUTHENTICATION)
                .status(outcome)
                .reasons(List.of())
                .expiryReason(expiryReason)
                .credential(credential)
                .build());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(ResponseEntity<?> response) {
        return (Map<String, Object>) response.getBody();
    }

    @Test
    @DisplayName("Pending → 200")
    void pending() {
        givenStatus(OperationOutcome.PENDING, null, null);

        assertEquals(200, controller.poll("tx-1").getStatusCode().value());
    }

    @Test
    @DisplayName("Completed with credential → 200 carrying it")
    void completedWithCredential() {
        OffsetDateTime exp = OffsetDateTime.parse("2026-03-01T11:00:00Z");
        IssuedCredential credential = new IssuedCredential("a", "r", "Bearer", exp, exp);
        givenStatus(OperationOutcome.COMPLETED, credential, null);

        ResponseEntity<?> response = controller.poll("tx-1");

        assertEquals(200, response.getStatusCode().value());
        assertSame(credential, ((OperationStatusResponse) response.getBody()).getCredential());
    }

    @Test
    @DisplayName("Completed, credential already collected → 409")
    void completedAlreadyDelivered() {
        givenStatus(OperationOutcome.COMPLETED, null, null);

        ResponseEntity<?> response = controller.poll("tx-1");

        assertEquals(409, response.getStatusCode().value());
        assertEquals("CREDENTIAL_ALREADY_DELIVERED", body(response).get("error"));
    }

    @Test
    @DisplayName("Manual review → 202")
    void manualReview() {
        givenStatus(OperationOutcome.MANUAL_REVIEW, null, null);

        ResponseEntity<?> response = controller.poll("tx-1");

        assertEquals(202, response.getStatusCode().value());
        assertEquals("MANUAL_REVIEW_REQUIRED", body(response).get("error"));
    }

    @Test
    @DisplayName("Failed → 401 PROOF_REJECTED")
    void failed() {
        givenStatus(OperationOutcome.FAILED, null, null);

        ResponseEntity<?> response = controller.poll("tx-1");

        assertEquals(401, response.getStatusCode().value());
        assertEquals("PROOF_REJECTED", body(response).get("error"));
    }

    @Test
    @DisplayName("Expired → 401 OPERATION_EXPIRED with the expiry reason")
    void expired() {
        givenStatus(OperationOutcome.EXPIRED, null, ExpiryReason.BUDGET_EXHAUSTED);

        ResponseEntity<?> response = controller.poll("tx-1");

        assertEquals(401, response.getStatusCode().value());
        assertEquals("OPERATION_EXPIRED", body(response).get("error"));
        assertEquals(ExpiryReason.BUDGET_EXHAUSTED, body(response).get("expiryReason"));
    }
}
