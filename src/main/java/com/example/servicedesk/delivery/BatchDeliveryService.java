package com.example.servicedesk.delivery;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.BatchStatus;
import com.example.servicedesk.domain.NotificationBatch;
import com.example.servicedesk.exception.DeliveryException;
import com.example.servicedesk.exception.TransientDeliveryException;
import com.example.servicedesk.repository.NotificationBatchRepository;
import com.example.servicedesk.service.AuditService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands READY batches to the delivery sink and records the outcome.
 *
 * READY -> PROCESSED on success. READY -> FAILED otherwise; a transient failure keeps a
 * {@code nextRetryAt} (doubling backoff) until the attempt budget is spent, a permanent
 * one does not. Sink calls are bounded by the configured timeout, and a timeout counts
 * as a transient failure.
 */
@Slf4j
@Service
public class BatchDeliveryService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final DeliverySink deliverySink;
    private final NotificationBatchRepository batchRepository;
    private final NotificationEngineProperties properties;
    private final Executor deliveryExecutor;
    private final Executor sinkExecutor;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public BatchDeliveryService(DeliverySink deliverySink,
                                NotificationBatchRepository batchRepository,
                                NotificationEngineProperties properties,
                                @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                                @Qualifier("sinkExecutor") Executor sinkExecutor,
                                AuditService auditService,
                                MeterRegistry meterRegistry,
                                Clock clock) {
        this.deliverySink = deliverySink;
        this.batchRepository = batchRepository;
        this.properties = properties;
        this.deliveryExecutor = deliveryExecutor;
        this.sinkExecutor = sinkExecutor;
        this.auditService = auditService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Delivers without blocking the caller when async delivery is enabled.
     */
    public void dispatch(NotificationBatch batch) {
        if (!properties.getDelivery().isAsync()) {
            deliver(batch);
            return;
        }
        try {
            deliveryExecutor.execute(() -> deliver(batch));
        } catch (RejectedExecutionException e) {
            log.warn("Delivery queue full, batch {} goes to the retry path", batch.getId());
            recordFailure(batch, new TransientDeliveryException("Delivery queue full", e));
        }
    }

    public void deliver(NotificationBatch batch) {
        long timeoutMs = properties.getDelivery().getTimeoutMs();
        Instant started = clock.instant();
        CompletableFuture<Void> call;
        try {
            call = CompletableFuture.runAsync(() -> {
                try {
                    deliverySink.deliver(batch);
                } catch (DeliveryException e) {
                    throw new CompletionException(e);
                }
            }, sinkExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Sink pool saturated, batch {} goes to the retry path", batch.getId());
            recordFailure(batch, new TransientDeliveryException("Sink pool saturated: " + e.getMessage(), e));
            return;
        }

        try {
            call.get(timeoutMs, TimeUnit.MILLISECONDS);
            recordSuccess(batch, started);
        } catch (TimeoutException e) {
            call.cancel(true);
            recordFailure(batch, new TransientDeliveryException("Delivery timed out after " + timeoutMs + " ms", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            DeliveryException failure = cause instanceof DeliveryException de
                    ? de
                    : new TransientDeliveryException("Unexpected delivery error: " + cause.getMessage(), cause);
            recordFailure(batch, failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(batch, new TransientDeliveryException("Delivery interrupted", e));
        }
    }

    private void recordSuccess(NotificationBatch batch, Instant started) {
        Instant now = clock.instant();
        meterRegistry.counter("servicedesk.delivery.attempts", "outcome", "success").increment();
        meterRegistry.timer("servicedesk.delivery.duration").record(Duration.between(started, now));

        if (batchRepository.markProcessed(batch.getId(), now) == 0) {
            log.debug("Batch {} was no longer READY after delivery", batch.getId());
            return;
        }
        log.info("Batch {} processed ({} notifications, key {})", batch.getId(), batch.size(), batch.getBatchKey());
        auditService.log("delivery", "BATCH_DELIVERED", batch.getId(),
                Map.of("batch_key", batch.getBatchKey(), "size", batch.size()));
    }

    private boolean recordFailure(NotificationBatch batch, DeliveryException failure) {
        Instant now = clock.instant();
        NotificationEngineProperties.DeliveryConfig delivery = properties.getDelivery();
        int attempts = batch.getDeliveryAttempts() + 1;
        Instant nextRetryAt = failure.isRetryable() && attempts < delivery.getMaxAttempts()
                ? now.plusMillis(backoffMs(attempts))
                : null;

        String outcome = failure.isRetryable() ? "transient_failure" : "permanent_failure";
        meterRegistry.counter("servicedesk.delivery.attempts", "outcome", outcome).increment();

        if (batchRepository.markFailed(batch.getId(), attempts, nextRetryAt, truncate(failure.getMessage()), now) == 0) {
            log.debug("Batch {} was no longer READY when recording failure", batch.getId());
            return false;
        }
        if (nextRetryAt != null) {
            log.warn("Delivery of batch {} failed (attempt {}/{}), retrying at {}: {}",
                    batch.getId(), attempts, delivery.getMaxAttempts(), nextRetryAt, failure.getMessage());
        } else {
            log.error("Delivery of batch {} failed permanently after {} attempt(s): {}",
                    batch.getId(), attempts, failure.getMessage());
        }
        auditService.log("delivery", "BATCH_DELIVERY_FAILED", batch.getId(), Map.of(
                "batch_key", batch.getBatchKey(),
                "attempts", attempts,
                "retryable", failure.isRetryable(),
                "error", String.valueOf(failure.getMessage())), false);
        return true;
    }

    long backoffMs(int attempts) {
        long initial = properties.getDelivery().getInitialBackoffMs();
        return initial * (1L << Math.min(attempts - 1, 20));
    }

    /**
     * Puts READY batches whose delivery never reported back on the failure path.
     * A batch counts as stalled once it has been READY longer than the delivery
     * timeout plus {@code delivery.stalled-grace-ms}.
     */
    public int recoverStalled(Instant now) {
        NotificationEngineProperties.DeliveryConfig delivery = properties.getDelivery();
        Instant cutoff = now.minusMillis(delivery.getTimeoutMs() + delivery.getStalledGraceMs());
        int recovered = 0;
        for (NotificationBatch stalled : batchRepository
                .findByStatusAndUpdatedAtLessThanEqualOrderByUpdatedAtAsc(BatchStatus.READY, cutoff)) {
            try {
                log.warn("Batch {} has been READY since {}, treating delivery as failed",
                        stalled.getId(), stalled.getUpdatedAt());
                if (recordFailure(stalled, new TransientDeliveryException(
                        "Delivery did not complete before " + cutoff))) {
                    recovered++;
                }
            } catch (Exception e) {
                log.error("Failed to recover stalled batch {}: {}", stalled.getId(), e.getMessage(), e);
            }
        }
        return recovered;
    }

    /**
     * Moves failed batches whose retry time has come back to READY and delivers them again.
     */
    public int retryDue(Instant now) {
        int retried = 0;
        for (NotificationBatch failed : batchRepository
                .findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(BatchStatus.FAILED, now)) {
            try {
                if (batchRepository.requeueFailed(failed.getId(), now) == 1) {
                    NotificationBatch ready = batchRepository.findById(failed.getId()).orElseThrow();
                    log.info("Retrying delivery of batch {} (attempt {})", ready.getId(), ready.getDeliveryAttempts() + 1);
                    dispatch(ready);
                    retried++;
                }
            } catch (Exception e) {
                log.error("Failed to retry batch {}: {}", failed.getId(), e.getMessage(), e);
            }
        }
        return retried;
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
