package com.bbms.authbroker.modules.lifecycle;

import com.bbms.authbroker.model.CompletionSource;
import com.bbms.authbroker.model.OperationState;
import com.bbms.authbroker.model.entity.BiometricOperation;
import com.bbms.authbroker.modules.detection.CompletionDetector;
import com.bbms.authbroker.repository.BiometricOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Expires pre-terminal operations past their provider-side expiry, e.g.
 * operations left unwatched by a restart. Operations parked in manual review
 * are left alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleOperationScheduler {

    private final BiometricOperationRepository operationRepository;
    private final CompletionDetector completionDetector;
    private final Clock clock;

    @Scheduled(fixedRateString = "${detection.sweep-interval-ms:60000}")
    public void expireStaleOperations() {
        List<BiometricOperation> stale = operationRepository.findStale(
                EnumSet.of(OperationState.CREATED, OperationState.PENDING), OffsetDateTime.now(clock));
        int expired = 0;
        for (BiometricOperation operation : stale) {
            try {
                completionDetector.expire(operation.getOperationId(), CompletionSource.SWEEPER);
                expired++;
            } catch (RuntimeException e) {
                log.error("Failed to expire stale operation {}: {}", operation.getOperationId(), e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expired {} stale biometric operation(s)", expired);
        }
    }
}
