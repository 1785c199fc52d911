package com.bbms.authbroker.exception;

import com.bbms.authbroker.modules.credential.InvalidCredentialException;
import com.bbms.authbroker.modules.lifecycle.AlreadyEnrolledException;
import com.bbms.authbroker.modules.lifecycle.OperationNotFoundException;
import com.bbms.authbroker.modules.operation.InvalidSubjectException;
import com.bbms.authbroker.modules.operation.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler that produces clean, safe error responses.
 * Stack traces are NEVER exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String CORRELATION_ID_KEY = "correlationId";

    /**
     * Handles bean-validation failures (e.g. @Valid on @RequestBody).
     * Returns 400 with a list of field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = baseBody(HttpStatus.BAD_REQUEST, "Validation Failed");
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InvalidSubjectException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSubject(InvalidSubjectException ex) {
        log.warn("Invalid subject: {}", ex.getMessage());
        Map<String, Object> body = baseBody(HttpStatus.BAD_REQUEST, "INVALID_SUBJECT");
        body.put("message", ex.getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.error("Biometric provider unavailable: {}", ex.getMessage());
        Map<String, Object> body = baseBody(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE");
        body.put("message", "Biometric service is temporarily unavailable. Please try again.");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(OperationNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(OperationNotFoundException ex) {
        log.info("{}", ex.getMessage());
        Map<String, Object> body = baseBody(HttpStatus.NOT_FOUND, "OPERATION_NOT_FOUND");
        body.put("message", "Biometric operation not found");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(AlreadyEnrolledException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyEnrolled(AlreadyEnrolledException ex) {
        log.info("{}", ex.getMessage());
        Map<String, Object> body = baseBody(HttpStatus.CONFLICT, "ALREADY_ENROLLED");
        body.put("message", "Biometric enrollment already completed. Use re-enroll to replace it.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(InvalidCredentialException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCredential(InvalidCredentialException ex) {
        log.info("Credential rejected: {}", ex.getMessage());
        Map<String, Object> body = baseBody(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIAL");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
    }

    /**
     * Catch-all handler for unhandled exceptions.
     * Returns 500 with correlation ID, never a stack trace.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        Map<String, Object> body = baseBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
        body.put("message", "An unexpected error occurred. Please reference correlationId for support.");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> baseBody(HttpStatus status, String error) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("correlationId", MDC.get(CORRELATION_ID_KEY));
        return body;
    }
}
