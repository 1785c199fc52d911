package com.bbms.authbroker.modules.detection;

import com.bbms.authbroker.modules.operation.dto.OperationStatus;
import com.bbms.authbroker.modules.operation.dto.RemoteResult;
import com.bbms.authbroker.modules.operation.dto.RemoteState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CompletionPredicateTest {

    private static final OffsetDateTime AT = OffsetDateTime.parse("2026-03-01T10:00:07Z");

    @Test
    @DisplayName("Success with CompletedAt → completed")
    void successWithTimestamp() {
        OperationStatus status = new OperationStatus(RemoteState.COMPLETED, RemoteResult.SUCCESS, AT);

        assertTrue(CompletionPredicate.isCompleted(status));
        assertEquals(Optional.of(DetectionType.COMPLETED), CompletionPredicate.classify(status));
    }

    @Test
    @DisplayName("Success without CompletedAt → premature, still pending")
    void successWithoutTimestamp() {
        OperationStatus status = new OperationStatus(RemoteState.PENDING, RemoteResult.SUCCESS, null);

        assertFalse(CompletionPredicate.isCompleted(status));
        assertTrue(CompletionPredicate.isPrematureSuccess(status));
        assertTrue(CompletionPredicate.classify(status).isEmpty());
    }

    @Test
    @DisplayName("Failed state, or Failure result with CompletedAt → failed")
    void failures() {
        assertEquals(Optional.of(DetectionType.FAILED), CompletionPredicate.classify(
                new OperationStatus(RemoteState.FAILED, RemoteResult.NONE, null)));
        assertEquals(Optional.of(DetectionType.FAILED), CompletionPredicate.classify(
                new OperationStatus(RemoteState.PENDING, RemoteResult.FAILURE, AT)));
        assertTrue(CompletionPredicate.classify(
                new OperationStatus(RemoteState.PENDING, RemoteResult.FAILURE, null)).isEmpty());
    }

    @Test
    @DisplayName("Expired state → expired")
    void expired() {
        assertEquals(Optional.of(DetectionType.EXPIRED), CompletionPredicate.classify(
                new OperationStatus(RemoteState.EXPIRED, RemoteResult.NONE, null)));
    }

    @Test
    @DisplayName("Not-yet-queryable, unreachable and null → pending")
    void nonAnswers() {
        assertTrue(CompletionPredicate.classify(OperationStatus.notYetQueryable()).isEmpty());
        assertTrue(CompletionPredicate.classify(OperationStatus.unreachable()).isEmpty());
        assertTrue(CompletionPredicate.classify(null).isEmpty());
        assertFalse(CompletionPredicate.isPrematureSuccess(null));
    }
}
