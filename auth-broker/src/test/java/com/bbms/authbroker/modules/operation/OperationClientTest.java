package com.bbms.authbroker.modules.operation;

import com.bbms.authbroker.config.ProviderProperties;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.modules.operation.dto.CreatedOperation;
import com.bbms.authbroker.modules.operation.dto.OperationStatus;
import com.bbms.authbroker.modules.operation.dto.ProofResult;
import com.bbms.authbroker.modules.operation.dto.RemoteResult;
import com.bbms.authbroker.modules.operation.dto.RemoteState;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class OperationClientTest {

    private static final String HOST = "https://provider.test";
    private static final String AUTHZ = HOST + "/IDCompleteBackendEngine/Default/AuthorizationServiceRest";
    private static final String ADMIN = HOST + "/IDCompleteBackendEngine/Default/AdministrationServiceRest";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ProviderTokenService tokenService;

    private MockRestServiceServer server;
    private OperationClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();

        ProviderProperties properties = new ProviderProperties();
        properties.setHostUrl(HOST);

        RetryRegistry retryRegistry = RetryRegistry.ofDefaults();
        retryRegistry.retry("providerCall", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(ProviderUnavailableException.class)
                .build());
        retryRegistry.retry("proofFetch", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(ProviderUnavailableException.class, ResultNotReadyException.class)
                .build());

        lenient().when(tokenService.getAccessToken()).thenReturn("provider-token");
        client = new OperationClient(restTemplate, tokenService, properties, retryRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ================================================================
    // createOperation
    // ================================================================

    @Test
    @DisplayName("Authentication creates a Verify_Identity transaction")
    void createAuthenticationTransaction() {
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer provider-token"))
                .andExpect(content().json("{\"AccountNumber\":\"acct-1\",\"Name\":\"Verify_Identity\","
                        + "\"Timeout\":300,\"ConfirmationPolicy\":{\"MinimumConfidence\":0.85,\"MaximumAttempts\":3}}"))
                .andRespond(withSuccess("{\"TransactionId\":\"tx-1\",\"OneTimeSecret\":\"otp-secret\"}",
                        MediaType.APPLICATION_JSON));

        CreatedOperation created = client.createOperation(OperationKind.AUTHENTICATION, "acct-1");

        assertEquals("tx-1", created.operationId());
        assertEquals("otp-secret", created.secret());
        assertEquals(OperationKind.AUTHENTICATION, created.kind());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(5), created.expiresAt());
        server.verify();
    }

    @Test
    @DisplayName("Enrollment tolerates an existing provider account")
    void createEnrollmentWithExistingAccount() {
        server.expect(once(), requestTo(ADMIN + "/v1/accounts"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.CONFLICT));
        server.expect(once(), requestTo(AUTHZ + "/v2/operations"))
                .andExpect(content().json("{\"AccountNumber\":\"acct-1\",\"Name\":\"EnrollBioCredential\","
                        + "\"Timeout\":3600,\"TransportType\":0}"))
                .andRespond(withSuccess("{\"OperationId\":\"op-1\",\"OneTimeSecret\":\"s\"}",
                        MediaType.APPLICATION_JSON));

        CreatedOperation created = client.createOperation(OperationKind.ENROLLMENT, "acct-1");

        assertEquals("op-1", created.operationId());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(1), created.expiresAt());
        server.verify();
    }

    @Test
    @DisplayName("4xx on create → InvalidSubjectException, not retried")
    void createRejectedByProvider() {
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

        assertThrows(InvalidSubjectException.class,
                () -> client.createOperation(OperationKind.AUTHENTICATION, "acct-1"));
        server.verify();
    }

    @Test
    @DisplayName("5xx on create → retried, then ProviderUnavailableException")
    void createProviderDown() {
        server.expect(times(3), requestTo(AUTHZ + "/v2/transactions"))
                .andRespond(withServerError());

        assertThrows(ProviderUnavailableException.class,
                () -> client.createOperation(OperationKind.AUTHENTICATION, "acct-1"));
        server.verify();
    }

    @Test
    @DisplayName("Blank subject is rejected without calling the provider")
    void blankSubjectRejected() {
        assertThrows(InvalidSubjectException.class,
                () -> client.createOperation(OperationKind.AUTHENTICATION, " "));
        verifyNoInteractions(tokenService);
    }

    // ================================================================
    // queryStatus
    // ================================================================

    @Test
    @DisplayName("404 on both collections → NOT_YET_QUERYABLE, not an error")
    void notFoundIsNotYetQueryable() {
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(once(), requestTo(AUTHZ + "/v2/operations/tx-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        OperationStatus status = client.queryStatus("tx-1", OperationKind.AUTHENTICATION);

        assertEquals(RemoteState.NOT_YET_QUERYABLE, status.remoteState());
        assertNull(status.completedAt());
        server.verify();
    }

    @Test
    @DisplayName("Enrollment status falls back to the transactions collection")
    void statusFallsBackToOtherCollection() {
        server.expect(once(), requestTo(AUTHZ + "/v2/operations/op-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/op-1"))
                .andRespond(withSuccess("{\"State\":1,\"Result\":1,\"CompletedAt\":\"2026-03-01T10:00:07\"}",
                        MediaType.APPLICATION_JSON));

        OperationStatus status = client.queryStatus("op-1", OperationKind.ENROLLMENT);

        assertEquals(RemoteState.COMPLETED, status.remoteState());
        assertEquals(RemoteResult.SUCCESS, status.resultCode());
        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:07Z"), status.completedAt());
        server.verify();
    }

    @Test
    @DisplayName("Success result with null CompletedAt is reported as-is")
    void nullCompletedAtPreserved() {
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withSuccess("{\"State\":0,\"Result\":1,\"CompletedAt\":null}",
                        MediaType.APPLICATION_JSON));

        OperationStatus status = client.queryStatus("tx-1", OperationKind.AUTHENTICATION);

        assertEquals(RemoteState.PENDING, status.remoteState());
        assertEquals(RemoteResult.SUCCESS, status.resultCode());
        assertNull(status.completedAt());
    }

    @Test
    @DisplayName("Provider down through the retry budget → UNREACHABLE, not an exception")
    void providerDownIsUnreachable() {
        server.expect(times(3), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withServerError());

        OperationStatus status = client.queryStatus("tx-1", OperationKind.AUTHENTICATION);

        assertEquals(RemoteState.UNREACHABLE, status.remoteState());
        server.verify();
    }

    @Test
    @DisplayName("401 evicts the cached provider token and retries")
    void unauthorizedEvictsToken() {
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withSuccess("{\"State\":0,\"Result\":0}", MediaType.APPLICATION_JSON));

        OperationStatus status = client.queryStatus("tx-1", OperationKind.AUTHENTICATION);

        assertEquals(RemoteState.PENDING, status.remoteState());
        verify(tokenService).evict();
    }

    // ================================================================
    // fetchResult
    // ================================================================

    private static final String COMPLETED_STATUS =
            "{\"State\":1,\"Result\":1,\"CompletedAt\":\"2026-03-01T10:00:07\"}";

    @Test
    @DisplayName("Result becomes available after one not-ready round")
    void fetchResultAfterLag() {
        server.expect(times(2), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withSuccess(COMPLETED_STATUS, MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/tx-1/result"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(once(), requestTo(AUTHZ + "/v2/operations/tx-1/result"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(once(), requestTo(AUTHZ + "/v2/transactions/tx-1/result"))
                .andRespond(withSuccess("{\"IsLive\":true,\"FaceMatchScore\":0.91,\"PadResult\":\"Pass\"}",
                        MediaType.APPLICATION_JSON));

        ProofResult proof = client.fetchResult("tx-1", OperationKind.AUTHENTICATION);

        assertEquals(Boolean.TRUE, proof.getLivenessPassed());
        assertEquals(0.91, proof.getMatchScore());
        assertFalse(proof.isPresentationAttackDetected());
        server.verify();
    }

    @Test
    @DisplayName("Result never available → ResultNotReadyException")
    void fetchResultNeverReady() {
        server.expect(times(3), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withSuccess(COMPLETED_STATUS, MediaType.APPLICATION_JSON));
        server.expect(times(3), requestTo(AUTHZ + "/v2/transactions/tx-1/result"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(times(3), requestTo(AUTHZ + "/v2/operations/tx-1/result"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThrows(ResultNotReadyException.class,
                () -> client.fetchResult("tx-1", OperationKind.AUTHENTICATION));
        server.verify();
    }

    @Test
    @DisplayName("Result body for a still-pending operation is never read → ResultNotReadyException")
    void fetchResultRefusedWhilePending() {
        server.expect(times(3), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withSuccess("{\"State\":0,\"Result\":0,\"CompletedAt\":null}",
                        MediaType.APPLICATION_JSON));

        assertThrows(ResultNotReadyException.class,
                () -> client.fetchResult("tx-1", OperationKind.AUTHENTICATION));
        server.verify();
    }

    @Test
    @DisplayName("Result for an operation not yet queryable anywhere → ResultNotReadyException")
    void fetchResultRefusedWhenUnknown() {
        server.expect(times(3), requestTo(AUTHZ + "/v2/transactions/tx-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(times(3), requestTo(AUTHZ + "/v2/operations/tx-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThrows(ResultNotReadyException.class,
                () -> client.fetchResult("tx-1", OperationKind.AUTHENTICATION));
        server.verify();
    }

    // ================================================================
    // deleteAccount
    // ================================================================

    @Test
    @DisplayName("Account deletion issues DELETE on the administration API")
    void deleteAccount() {
        server.expect(once(), requestTo(ADMIN + "/v1/accounts/acct-1"))
                .andExpect(method(HttpMethod.DELETE))
                .andExpect(header("Authorization", "Bearer provider-token"))
                .andRespond(withSuccess());

        assertDoesNotThrow(() -> client.deleteAccount("acct-1"));
        server.verify();
    }

    @Test
    @DisplayName("Account already gone (404) → deletion succeeds")
    void deleteMissingAccount() {
        server.expect(once(), requestTo(ADMIN + "/v1/accounts/acct-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertDoesNotThrow(() -> client.deleteAccount("acct-1"));
        server.verify();
    }

    @Test
    @DisplayName("Provider down during deletion → retried, then ProviderUnavailableException")
    void deleteAccountProviderDown() {
        server.expect(times(3), requestTo(ADMIN + "/v1/accounts/acct-1"))
                .andRespond(withServerError());

        assertThrows(ProviderUnavailableException.class, () -> client.deleteAccount("acct-1"));
        server.verify();
    }

    // ================================================================
    // Timestamps
    // ================================================================

    @Test
    @DisplayName("Timestamps parse with or without offset; the .NET default means unset")
    void parsesProviderTimestamps() {
        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:07Z"),
                OperationClient.parseTimestamp("2026-03-01T10:00:07Z"));
        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:07Z"),
                OperationClient.parseTimestamp("2026-03-01T10:00:07"));
        assertNull(OperationClient.parseTimestamp("0001-01-01T00:00:00"));
        assertNull(OperationClient.parseTimestamp("not-a-date"));
        assertNull(OperationClient.parseTimestamp(null));
    }
}
