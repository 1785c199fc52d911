package com.bbms.authbroker.modules.detection;

import com.bbms.authbroker.config.DetectionProperties;
import com.bbms.authbroker.model.CompletionSource;
import com.bbms.authbroker.model.ExpiryReason;
import com.bbms.authbroker.model.OperationOutcome;
import com.bbms.authbroker.model.OperationKind;
import com.bbms.authbroker.modules.detection.dto.CaptureEvent;
import com.bbms.authbroker.modules.operation.OperationClient;
import com.bbms.authbroker.modules.operation.dto.OperationStatus;
import com.bbms.authbroker.modules.operation.dto.RemoteResult;
import com.bbms.authbroker.modules.operation.dto.RemoteState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reconciles the completion signals of an operation.
 * <ul>
 * <li>Poll signal: {@code queryStatus} on a fixed delay until a terminal
 * observation or the budget runs out</li>
 * <li>Event signal: the capture surface reporting the verified page</li>
 * <li>Provider signal: a signed provider webhook</li>
 * </ul>
 * <p>
 * Each watched operation has its own lock. A signal taking the lock hands its
 * detection to the {@link CompletionListener}; the watch is closed (polling
 * cancelled) only once the listener reports a decided outcome. A detection
 * the listener leaves pending, or one it fails on, keeps the operation
 * polled until the budget runs out.
 * </p>
 */
@Slf4j
@Component
public class CompletionDetector {

    private final Map<String, OperationWatch> watches = new ConcurrentHashMap<>();

    private final OperationClient operationClient;
    private final CompletionListener listener;
    private final TaskScheduler taskScheduler;
    private final DetectionProperties properties;
    private final Clock clock;

    public CompletionDetector(OperationClient operationClient,
            CompletionListener listener,
            @Qualifier("detectionScheduler") TaskScheduler taskScheduler,
            DetectionProperties properties,
            Clock clock) {
        this.operationClient = operationClient;
        this.listener = listener;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    // ================================================================
    // Poll signal
    // ================================================================

    /**
     * Start polling an operation. A second call for the same id is a no-op.
     *
     * @param expiresAt provider-side expiry; polling never outlives it
     */
    public void watch(String operationId, OperationKind kind, OffsetDateTime expiresAt) {
        OffsetDateTime budgetEnd = OffsetDateTime.now(clock).plus(properties.getMaxWait());
        OperationWatch watch = new OperationWatch(operationId, kind, budgetEnd, expiresAt);

        // Registered while locked: a signal finding the watch waits until its task exists.
        watch.lock.lock();
        try {
            if (watches.putIfAbsent(operationId, watch) != null) {
                log.debug("Operation already watched: operationId={}", operationId);
                return;
            }
            watch.future = taskScheduler.scheduleWithFixedDelay(
                    () -> poll(operationId), properties.getPollInterval());
        } finally {
            watch.lock.unlock();
        }
        log.info("Watching operation: operationId={}, kind={}, interval={}, maxAttempts={}, budgetEnd={}",
                operationId, kind, properties.getPollInterval(), properties.getMaxAttempts(), budgetEnd);
    }

    /**
     * One polling tick. Never throws, so the scheduled task stays healthy.
     * The budget is checked on every tick, whether or not the query worked.
     */
    void poll(String operationId) {
        OperationWatch watch = watches.get(operationId);
        if (watch == null) {
            return;
        }

        watch.lock.lock();
        try {
            if (watch.closed) {
                return;
            }
            Detection detection = budgetExpiry(watch);
            if (detection == null) {
                watch.attempts++;
                detection = observe(watch);
                if (detection == null) {
                    detection = budgetExpiry(watch);
                }
            }

            if (detection != null) {
                log.info("Detection by poll: operationId={}, type={}, attempts={}",
                        operationId, detection.type(), watch.attempts);
                deliver(watch, detection);
            }
        } catch (RuntimeException e) {
            log.error("Polling tick failed, operation stays watched: operationId={}, attempt={}: {}",
                    operationId, watch.attempts, e.getMessage(), e);
        } finally {
            watch.lock.unlock();
        }
    }

    /** Query once; any failure counts as a pending observation. */
    private Detection observe(OperationWatch watch) {
        String operationId = watch.operationId;
        try {
            OperationStatus status = operationClient.queryStatus(operationId, watch.kind);
            Detection detection = evaluate(operationId, status);
            if (detection == null) {
                if (CompletionPredicate.isPrematureSuccess(status)) {
                    log.warn("Success reported without CompletedAt, still pending: operationId={}, attempt={}",
                            operationId, watch.attempts);
                }
                if (status.remoteState() == RemoteState.PENDING && !watch.pendingReported) {
                    watch.pendingReported = true;
                    listener.onPending(operationId, status);
                }
            }
            return detection;
        } catch (RuntimeException e) {
            log.error("Status query failed: operationId={}, attempt={}: {}",
                    operationId, watch.attempts, e.getMessage(), e);
            return null;
        }
    }

    private Detection evaluate(String operationId, OperationStatus status) {
        Optional<DetectionType> type = CompletionPredicate.classify(status);
        if (type.isEmpty()) {
            return null;
        }
        return switch (type.get()) {
            case COMPLETED -> Detection.completed(operationId, CompletionSource.POLL, status);
            case FAILED -> Detection.failed(operationId, CompletionSource.POLL, status);
            case EXPIRED -> new Detection(operationId, DetectionType.EXPIRED, CompletionSource.POLL,
                    status, ExpiryReason.OPERATION_EXPIRED);
        };
    }

    private Detection budgetExpiry(OperationWatch watch) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (watch.expiresAt != null && !now.isBefore(watch.expiresAt)) {
            return Detection.expired(watch.operationId, CompletionSource.POLL, ExpiryReason.OPERATION_EXPIRED);
        }
        if (watch.attempts >= properties.getMaxAttempts() || !now.isBefore(watch.budgetEnd)) {
            ExpiryReason reason = watch.proofPending ? ExpiryReason.PROOF_UNAVAILABLE : ExpiryReason.BUDGET_EXHAUSTED;
            log.warn("Polling budget exhausted: operationId={}, attempts={}, reason={}",
                    watch.operationId, watch.attempts, reason);
            return Detection.expired(watch.operationId, CompletionSource.POLL, reason);
        }
        return null;
    }

    // ================================================================
    // Event signal
    // ================================================================

    /**
     * Handle a message from the capture surface. Only the verified-page
     * success shape is a completion signal. The client's own timestamp is not
     * trusted; the provider's completion time replaces the receipt time once
     * the completion is confirmed.
     */
    public SignalAck onCaptureEvent(String operationId, CaptureEvent event) {
        if (event == null || !event.isVerifiedSuccess()) {
            log.info("Capture event ignored: operationId={}, type={}, pageName={}, success={}",
                    operationId,
                    event != null ? event.getType() : null,
                    event != null ? event.getPageName() : null,
                    event != null ? event.getSuccess() : null);
            return SignalAck.IGNORED;
        }

        Detection detection = Detection.completed(operationId, CompletionSource.EVENT,
                new OperationStatus(RemoteState.COMPLETED, RemoteResult.SUCCESS, OffsetDateTime.now(clock)));

        log.info("Verified-page event received: operationId={}, clientOccurredAt={}",
                operationId, event.getOccurredAt());
        return dispatch(detection);
    }

    /**
     * Handle a signed provider notification that an operation finished.
     *
     * @param succeeded whether the provider reported a completed or a failed operation
     */
    public SignalAck onProviderNotification(String operationId, boolean succeeded) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Detection detection = succeeded
                ? Detection.completed(operationId, CompletionSource.WEBHOOK,
                        new OperationStatus(RemoteState.COMPLETED, RemoteResult.SUCCESS, now))
                : Detection.failed(operationId, CompletionSource.WEBHOOK,
                        new OperationStatus(RemoteState.FAILED, RemoteResult.FAILURE, now));
        log.info("Provider notification received: operationId={}, succeeded={}", operationId, succeeded);
        return dispatch(detection);
    }

    // ================================================================
    // Local termination
    // ================================================================

    /**
     * Stop polling and expire the operation on behalf of the caller.
     */
    public SignalAck cancel(String operationId) {
        return dispatch(Detection.expired(operationId, CompletionSource.CALLER, ExpiryReason.CANCELLED));
    }

    /**
     * Expire an operation whose provider-side lifetime has passed.
     */
    public SignalAck expire(String operationId, CompletionSource source) {
        return dispatch(Detection.expired(operationId, source, ExpiryReason.OPERATION_EXPIRED));
    }

    public boolean isWatching(String operationId) {
        return watches.containsKey(operationId);
    }

    public int activeWatchCount() {
        return watches.size();
    }

    @PreDestroy
    public void shutdown() {
        watches.values().forEach(watch -> {
            watch.lock.lock();
            try {
                close(watch);
            } finally {
                watch.lock.unlock();
            }
        });
        log.info("Completion detector stopped");
    }

    // ================================================================
    // Helpers
    // ================================================================

    private SignalAck dispatch(Detection detection) {
        OperationWatch watch = watches.get(detection.operationId());
        if (watch == null) {
            if (listener.isSettled(detection.operationId())) {
                return SignalAck.ALREADY_TERMINAL;
            }
            listener.onDetection(detection);
            return SignalAck.ACCEPTED;
        }

        watch.lock.lock();
        try {
            if (watch.closed) {
                log.info("Signal discarded, operation already decided: operationId={}, source={}",
                        detection.operationId(), detection.source());
                return SignalAck.ALREADY_TERMINAL;
            }
            log.info("Detection by {}: operationId={}, type={}",
                    detection.source(), detection.operationId(), detection.type());
            deliver(watch, detection);
            return SignalAck.ACCEPTED;
        } finally {
            watch.lock.unlock();
        }
    }

    /**
     * Caller holds the watch lock. If the listener throws, the watch stays
     * open and the next tick tries again.
     */
    private void deliver(OperationWatch watch, Detection detection) {
        OperationOutcome outcome = listener.onDetection(detection);
        if (outcome == OperationOutcome.PENDING) {
            if (detection.type() == DetectionType.COMPLETED && detection.source() == CompletionSource.POLL) {
                watch.proofPending = true;
            }
            log.info("Operation still pending after {} detection, polling continues: operationId={}",
                    detection.source(), watch.operationId);
            return;
        }
        close(watch);
    }

    /** Caller holds the watch lock. */
    private void close(OperationWatch watch) {
        watch.closed = true;
        if (watch.future != null) {
            watch.future.cancel(false);
        }
        watches.remove(watch.operationId, watch);
    }
}
