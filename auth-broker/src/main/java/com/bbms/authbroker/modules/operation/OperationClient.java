package com.bbms.authbroker.modules.operation;

import com.bbms.authbroker.config.ProviderProperties;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.modules.operation.dto.CreatedOperation;
import com.bbms.authbroker.modules.operation.dto.OperationStatus;
import com.bbms.authbroker.modules.operation.dto.ProofResult;
import com.bbms.authbroker.modules.operation.dto.RemoteResult;
import com.bbms.authbroker.modules.operation.dto.RemoteState;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP client for the biometric provider's operation API.
 * <p>
 * Enrollment runs as an {@code EnrollBioCredential} operation, authentication
 * as a {@code Verify_Identity} transaction. Right after creation the provider
 * answers 404 on the query side for anywhere between seconds and minutes;
 * that is reported as {@link RemoteState#NOT_YET_QUERYABLE}, never thrown.
 * </p>
 */
@Slf4j
@Component
public class OperationClient {

    private static final String ENROLL_OPERATION_NAME = "EnrollBioCredential";
    private static final String VERIFY_OPERATION_NAME = "Verify_Identity";
    private static final int TRANSPORT_PUSH = 0;
    private static final int CREDENTIAL_FACE = 1;

    private final RestTemplate restTemplate;
    private final ProviderTokenService tokenService;
    private final ProviderProperties properties;
    private final Retry providerRetry;
    private final Retry proofRetry;
    private final Clock clock;

    public OperationClient(RestTemplate providerRestTemplate,
            ProviderTokenService tokenService,
            ProviderProperties properties,
            RetryRegistry retryRegistry,
            Clock clock) {
        this.restTemplate = providerRestTemplate;
        this.tokenService = tokenService;
        this.properties = properties;
        this.providerRetry = retryRegistry.retry("providerCall");
        this.proofRetry = retryRegistry.retry("proofFetch");
        this.clock = clock;
    }

    // ================================================================
    // Create
    // ================================================================

    /**
     * Create a remote operation for the given subject.
     *
     * @param kind       enrollment or authentication
     * @param subjectRef provider account number (the local user id)
     * @return the created operation with its one-time secret
     * @throws InvalidSubjectException     on a 4xx from the provider
     * @throws ProviderUnavailableException when the provider stays unavailable
     *                                      through the retry budget
     */
    public CreatedOperation createOperation(OperationKind kind, String subjectRef) {
        if (subjectRef == null || subjectRef.isBlank()) {
            throw new InvalidSubjectException("Subject reference is required");
        }
        return providerRetry.executeSupplier(() -> kind == OperationKind.ENROLLMENT
                ? createEnrollment(subjectRef)
                : createAuthentication(subjectRef));
    }

    private CreatedOperation createEnrollment(String subjectRef) {
        ensureAccount(subjectRef);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("AccountNumber", subjectRef);
        body.put("Codeword", "");
        body.put("Name", ENROLL_OPERATION_NAME);
        body.put("Timeout", properties.getEnrollmentTimeout().toSeconds());
        body.put("TransportType", TRANSPORT_PUSH);
        body.put("Tag", "bbms-enrollment-" + clock.millis());

        Map<String, Object> response = post(properties.getAuthorizationUrl() + "/v2/operations", body);
        String operationId = requireId(response, "OperationId");

        log.info("Enrollment operation created: operationId={}, account={}", operationId, subjectRef);
        return new CreatedOperation(operationId, OperationKind.ENROLLMENT,
                (String) response.get("OneTimeSecret"),
                OffsetDateTime.now(clock).plus(properties.getEnrollmentTimeout()));
    }

    private CreatedOperation createAuthentication(String subjectRef) {
        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("TransportType", TRANSPORT_PUSH);
        policy.put("CredentialType", CREDENTIAL_FACE);
        policy.put("MinimumConfidence", properties.getMinimumConfidence());
        policy.put("MaximumAttempts", properties.getMaximumAttempts());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("AccountNumber", subjectRef);
        body.put("Timeout", properties.getAuthenticationTimeout().toSeconds());
        body.put("ConfirmationPolicy", policy);
        body.put("Name", VERIFY_OPERATION_NAME);

        Map<String, Object> response = post(properties.getAuthorizationUrl() + "/v2/transactions", body);
        String transactionId = requireId(response, "TransactionId");

        log.info("Authentication transaction created: operationId={}, account={}", transactionId, subjectRef);
        return new CreatedOperation(transactionId, OperationKind.AUTHENTICATION,
                (String) response.get("OneTimeSecret"),
                OffsetDateTime.now(clock).plus(properties.getAuthenticationTimeout()));
    }

    /**
     * Provision the provider account an enrollment binds to. An account that
     * already exists (409, or 400 on some tenants) is fine.
     */
    private void ensureAccount(String subjectRef) {
        Map<String, Object> account = new LinkedHashMap<>();
        account.put("AccountNumber", subjectRef);
        account.put("Version", 0);
        account.put("DisplayName", subjectRef);
        account.put("Rules", 1);
        account.put("Enabled", true);
        account.put("Custom", true);

        try {
            post(properties.getAdministrationUrl() + "/v1/accounts", account);
            log.info("Provider account created: account={}", subjectRef);
        } catch (InvalidSubjectException e) {
            if (e.getCause() instanceof HttpClientErrorException http
                    && (http.getStatusCode().value() == HttpStatus.CONFLICT.value()
                            || http.getStatusCode().value() == HttpStatus.BAD_REQUEST.value())) {
                log.info("Provider account already exists, continuing: account={}", subjectRef);
                return;
            }
            throw e;
        }
    }

    // ================================================================
    // Account
    // ================================================================

    /**
     * Delete the provider account of a subject together with the biometric
     * credentials bound to it. An account the provider no longer knows is
     * already gone.
     *
     * @throws ProviderUnavailableException when the provider stays unavailable
     */
    public void deleteAccount(String subjectRef) {
        if (subjectRef == null || subjectRef.isBlank()) {
            throw new InvalidSubjectException("Subject reference is required");
        }
        String url = properties.getAdministrationUrl() + "/v1/accounts/" + subjectRef;
        providerRetry.executeRunnable(() -> {
            try {
                restTemplate.exchange(url, HttpMethod.DELETE, new HttpEntity<>(authHeaders()), Void.class);
                log.info("Provider account deleted: account={}", subjectRef);
            } catch (HttpClientErrorException.NotFound e) {
                log.info("Provider account already absent: account={}", subjectRef);
            } catch (HttpClientErrorException.Unauthorized e) {
                tokenService.evict();
                throw new ProviderUnavailableException("Provider rejected access token", e);
            } catch (HttpClientErrorException e) {
                throw new InvalidSubjectException(
                        "Provider rejected account deletion: HTTP " + e.getStatusCode().value(), e);
            } catch (RestClientException e) {
                throw new ProviderUnavailableException("Provider call failed: " + url, e);
            }
        });
    }

    // ================================================================
    // Status
    // ================================================================

    /**
     * Query the remote status of an operation. Never throws for "not found"
     * or transient provider trouble.
     *
     * @param operationId provider operation or transaction id
     * @param kind        decides which collection is asked first
     * @return the observed status
     */
    public OperationStatus queryStatus(String operationId, OperationKind kind) {
        try {
            return providerRetry.executeSupplier(() -> fetchStatus(operationId, kind));
        } catch (ProviderUnavailableException e) {
            log.warn("Provider unreachable while polling operationId={}: {}", operationId, e.getMessage());
            return OperationStatus.unreachable();
        }
    }

    private OperationStatus fetchStatus(String operationId, OperationKind kind) {
        for (String collection : collectionsFor(kind)) {
            Optional<Map<String, Object>> body = get(
                    properties.getAuthorizationUrl() + "/v2/" + collection + "/" + operationId);
            if (body.isPresent()) {
                Map<String, Object> status = body.get();
                OperationStatus observed = new OperationStatus(
                        RemoteState.fromCode(toInteger(status.get("State"))),
                        RemoteResult.fromCode(toInteger(status.get("Result"))),
                        parseTimestamp(status.get("CompletedAt")));
                log.debug("Operation status: operationId={}, collection={}, state={}, result={}, completedAt={}",
                        operationId, collection, observed.remoteState(), observed.resultCode(),
                        observed.completedAt());
                return observed;
            }
        }
        log.info("Operation not yet queryable: operationId={}", operationId);
        return OperationStatus.notYetQueryable();
    }

    // ================================================================
    // Result
    // ================================================================

    /**
     * Fetch the proof of a terminal operation. The provider status is read
     * first; a result body is never trusted for an operation the provider
     * still reports as unfinished. Retries while the provider catches up.
     *
     * @throws ResultNotReadyException      if the operation is not terminal or no result became available
     * @throws ProviderUnavailableException if the provider stayed unavailable
     */
    public ProofResult fetchResult(String operationId, OperationKind kind) {
        return proofRetry.executeSupplier(() -> {
            OperationStatus status = fetchStatus(operationId, kind);
            if (!status.remoteState().isTerminal()) {
                log.info("Result requested before terminal state: operationId={}, state={}",
                        operationId, status.remoteState());
                throw new ResultNotReadyException(operationId);
            }
            for (String collection : collectionsFor(kind)) {
                Optional<Map<String, Object>> body = get(
                        properties.getAuthorizationUrl() + "/v2/" + collection + "/" + operationId + "/result");
                if (body.isPresent() && !body.get().isEmpty()) {
                    log.info("Proof retrieved: operationId={}, keys={}", operationId, body.get().keySet());
                    return ProofResult.fromProvider(body.get());
                }
            }
            throw new ResultNotReadyException(operationId);
        });
    }

    // ================================================================
    // Helpers
    // ================================================================

    private List<String> collectionsFor(OperationKind kind) {
        return kind == OperationKind.AUTHENTICATION
                ? List.of("transactions", "operations")
                : List.of("operations", "transactions");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> post(String url, Object body) {
        try {
            ResponseEntity<Map> response = restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(body, authHeaders()), Map.class);
            return response.getBody() != null ? response.getBody() : Map.of();
        } catch (HttpClientErrorException.Unauthorized e) {
            tokenService.evict();
            throw new ProviderUnavailableException("Provider rejected access token", e);
        } catch (HttpClientErrorException e) {
            throw new InvalidSubjectException(
                    "Provider rejected request: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Provider call failed: " + url, e);
        }
    }

    /** GET returning empty on 404. */
    @SuppressWarnings("unchecked")
    private Optional<Map<String, Object>> get(String url) {
        try {
            ResponseEntity<Map> response = restTemplate.exchange(url, HttpMethod.GET,
                    new HttpEntity<>(authHeaders()), Map.class);
            return Optional.of(response.getBody() != null ? response.getBody() : Map.of());
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (HttpClientErrorException.Unauthorized e) {
            tokenService.evict();
            throw new ProviderUnavailableException("Provider rejected access token", e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Provider call failed: " + url, e);
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(tokenService.getAccessToken());
        return headers;
    }

    private static String requireId(Map<String, Object> response, String field) {
        Object id = response.get(field);
        if (!(id instanceof String value) || value.isBlank()) {
            throw new ProviderUnavailableException("Provider response carried no " + field);
        }
        return value;
    }

    private static Integer toInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Provider timestamps come with or without an offset; offset-less values
     * are UTC. The .NET default {@code 0001-01-01T00:00:00} means "not set".
     */
    static OffsetDateTime parseTimestamp(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return null;
        }
        OffsetDateTime parsed;
        try {
            parsed = OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            try {
                parsed = LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                log.warn("Unparseable provider timestamp: {}", text);
                return null;
            }
        }
        return parsed.getYear() <= 1 ? null : parsed;
    }
}
