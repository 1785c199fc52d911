package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.CompletionSource;
import com.bbms.authbroker.model.entity.BiometricOperation;
import com.bbms.authbroker.modules.detection.CompletionDetector;
import com.bbms.authbroker.repository.BiometricOperationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class StaleOperationSchedulerTest {

    @Mock
    private BiometricOperationRepository operationRepository;
    @Mock
    private CompletionDetector completionDetector;

    private StaleOperationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new StaleOperationScheduler(operationRepository, completionDetector,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Stale operations are expired through the detector with source SWEEPER")
    void expiresStale() {
        when(operationRepository.findStale(anyCollection(), any())).thenReturn(List.of(
                BiometricOperation.builder().operationId("tx-1").build(),
                BiometricOperation.builder().operationId("op-2").build()));

        scheduler.expireStaleOperations();

        verify(completionDetector).expire("tx-1", CompletionSource.SWEEPER);
        verify(completionDetector).expire("op-2", CompletionSource.SWEEPER);
    }

    @Test
    @DisplayName("One failing expiry does not stop the sweep")
    void failureContained() {
        when(operationRepository.findStale(anyCollection(), any())).thenReturn(List.of(
                BiometricOperation.builder().operationId("tx-1").build(),
                BiometricOperation.builder().operationId("op-2").build()));
        when(completionDetector.expire("tx-1", CompletionSource.SWEEPER))
                .thenThrow(new OperationNotFoundException("tx-1"));

        scheduler.expireStaleOperations();

        verify(completionDetector).expire("op-2", CompletionSource.SWEEPER);
    }
}
