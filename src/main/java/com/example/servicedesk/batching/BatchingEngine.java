package com.example.servicedesk.batching;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.delivery.BatchDeliveryService;
import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.BatchStatus;
import com.example.servicedesk.domain.NotificationBatch;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.exception.EntityNotFoundException;
import com.example.servicedesk.locking.EntityLockRegistry;
import com.example.servicedesk.repository.BatchConfigurationRepository;
import com.example.servicedesk.repository.NotificationBatchRepository;
import com.example.servicedesk.service.AuditService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Batching Engine - groups allowed events into size and time bounded batches
 * and hands flushed batches to delivery.
 *
 * A (batchKey, groupKey) pair owns at most one PENDING batch. Every mutation of that
 * batch happens under the pair's lock, and only a successful PENDING to READY transition
 * dispatches it, so a size-triggered flush and a deadline flush can race safely.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchingEngine {

    public static final String IMMEDIATE_BATCH_KEY = "immediate";

    private final BatchConfigurationRepository configRepository;
    private final NotificationBatchRepository batchRepository;
    private final GroupKeyResolver groupKeyResolver;
    private final DeferredSubmissionQueue deferredQueue;
    private final EntityLockRegistry lockRegistry;
    private final BatchDeliveryService deliveryService;
    private final NotificationEngineProperties properties;
    private final AuditService auditService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public void submit(NotificationEvent event) {
        submit(event, null);
    }

    /**
     * Accepts an allowed event. An event delayed into the future waits outside
     * any batch and joins accumulation once {@code delayUntil} has passed.
     */
    public void submit(NotificationEvent event, Instant delayUntil) {
        if (delayUntil != null && delayUntil.isAfter(clock.instant())) {
            deferredQueue.defer(event, delayUntil);
            log.debug("Deferred event {} ({}) until {}", event.getId(), event.getType(), delayUntil);
            return;
        }
        accept(event);
    }

    void accept(NotificationEvent event) {
        Optional<BatchConfiguration> config = bypassesBatching(event) ? Optional.empty() : resolveConfiguration(event);
        if (config.isEmpty()) {
            deliverAlone(event);
            return;
        }
        accumulate(event, config.get());
    }

    boolean bypassesBatching(NotificationEvent event) {
        NotificationEngineProperties.BatchingConfig batching = properties.getBatching();
        return !event.isBatchable()
                || (batching.isBypassCritical() && event.getPriority() == NotificationPriority.CRITICAL)
                || batching.getImmediateTypes().contains(event.getType());
    }

    /**
     * Explicit batch key first, then the configuration listing the event type,
     * then the default batch key. Empty when no active configuration applies.
     */
    Optional<BatchConfiguration> resolveConfiguration(NotificationEvent event) {
        List<BatchConfiguration> active = configRepository.findByActiveTrueOrderByBatchKeyAsc();
        if (event.getBatchKey() != null) {
            Optional<BatchConfiguration> explicit = active.stream()
                    .filter(c -> c.getBatchKey().equals(event.getBatchKey()))
                    .findFirst();
            if (explicit.isPresent()) {
                return explicit;
            }
            log.warn("Event {} names unknown or inactive batch key '{}', routing by type",
                    event.getId(), event.getBatchKey());
        }
        Optional<BatchConfiguration> byType = active.stream()
                .filter(c -> c.getEventTypes() != null && c.getEventTypes().contains(event.getType()))
                .findFirst();
        if (byType.isPresent()) {
            return byType;
        }
        String defaultKey = properties.getBatching().getDefaultBatchKey();
        return active.stream()
                .filter(c -> c.getBatchKey().equals(defaultKey))
                .findFirst();
    }

    private void accumulate(NotificationEvent event, BatchConfiguration config) {
        String groupKey = groupKeyResolver.resolve(event, config);
        String lockKey = EntityLockRegistry.batchGroupKey(config.getBatchKey(), groupKey);
        List<String> readied = new ArrayList<>();

        lockRegistry.withLock(lockKey, () -> {
            Instant now = clock.instant();
            NotificationBatch batch = batchRepository
                    .findFirstByBatchKeyAndGroupKeyAndStatusOrderByCreatedAtDesc(config.getBatchKey(), groupKey, BatchStatus.PENDING)
                    .orElse(null);

            // The configured size may have shrunk since this batch was opened
            if (batch != null && batch.size() >= config.getMaxBatchSize()) {
                if (markReady(batch.getId(), now)) {
                    readied.add(batch.getId());
                }
                batch = null;
            }
            if (batch == null) {
                batch = NotificationBatch.builder()
                        .id(UUID.randomUUID().toString())
                        .batchKey(config.getBatchKey())
                        .groupKey(groupKey)
                        .status(BatchStatus.PENDING)
                        .createdAt(now)
                        .scheduledAt(now.plus(Duration.ofMillis(config.getMaxWaitTimeMs())))
                        .build();
                log.debug("Opened batch {} for {}/{} (flush at {})",
                        batch.getId(), config.getBatchKey(), groupKey, batch.getScheduledAt());
            }

            batch.getNotifications().add(event);
            if (event.getTargetUserIds() != null) {
                batch.getTargetUserIds().addAll(event.getTargetUserIds());
            }
            batch.setUpdatedAt(now);
            NotificationBatch saved = batchRepository.save(batch);

            if (saved.size() >= config.getMaxBatchSize() && markReady(saved.getId(), now)) {
                log.info("Batch {} reached max size {}, flushing", saved.getId(), config.getMaxBatchSize());
                readied.add(saved.getId());
            }
        });

        readied.forEach(id -> dispatch(id, "size"));
    }

    private void deliverAlone(NotificationEvent event) {
        Instant now = clock.instant();
        NotificationBatch batch = NotificationBatch.builder()
                .id(UUID.randomUUID().toString())
                .batchKey(IMMEDIATE_BATCH_KEY)
                .groupKey("event_" + event.getId())
                .status(BatchStatus.PENDING)
                .createdAt(now)
                .scheduledAt(now)
                .targetUserIds(new LinkedHashSet<>(event.getTargetUserIds() != null ? event.getTargetUserIds() : List.of()))
                .updatedAt(now)
                .build();
        batch.getNotifications().add(event);
        batchRepository.save(batch);
        log.debug("Event {} ({}, {}) bypasses batching", event.getId(), event.getType(), event.getPriority());
        flush(batch.getId(), "bypass");
    }

    /**
     * Flushes a pending batch. Returns false, without side effects, when the batch
     * is already past PENDING.
     */
    public boolean flush(String batchId) {
        return flush(batchId, "manual");
    }

    private boolean flush(String batchId, String trigger) {
        NotificationBatch batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new EntityNotFoundException("NotificationBatch", batchId));
        String lockKey = EntityLockRegistry.batchGroupKey(batch.getBatchKey(), batch.getGroupKey());
        boolean readied = lockRegistry.withLock(lockKey, () -> markReady(batchId, clock.instant()));
        if (!readied) {
            log.debug("Batch {} already flushed, ignoring {} flush", batchId, trigger);
            return false;
        }
        dispatch(batchId, trigger);
        return true;
    }

    private boolean markReady(String batchId, Instant now) {
        return batchRepository.transitionStatus(batchId, BatchStatus.PENDING, BatchStatus.READY, now) == 1;
    }

    private void dispatch(String batchId, String trigger) {
        NotificationBatch batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new EntityNotFoundException("NotificationBatch", batchId));
        meterRegistry.counter("servicedesk.batches.flushed",
                "batch_key", batch.getBatchKey(), "trigger", trigger).increment();
        auditService.log("batching-engine", "BATCH_FLUSHED", batchId, Map.of(
                "batch_key", batch.getBatchKey(),
                "group_key", batch.getGroupKey(),
                "size", batch.size(),
                "trigger", trigger));
        deliveryService.dispatch(batch);
    }

    /**
     * One scheduler sweep: release due deferred events, flush pending batches whose
     * deadline passed, fail stalled deliveries, then retry failed deliveries that are due.
     * Each item is isolated; one failure never stops the sweep.
     */
    public int flushDue() {
        Instant now = clock.instant();

        for (NotificationEvent event : deferredQueue.drainDue(now)) {
            try {
                accept(event);
            } catch (Exception e) {
                log.error("Failed to release deferred event {}: {}", event.getId(), e.getMessage(), e);
            }
        }

        int flushed = 0;
        for (NotificationBatch batch : batchRepository
                .findByStatusAndScheduledAtLessThanEqualOrderByScheduledAtAsc(BatchStatus.PENDING, now)) {
            try {
                if (flush(batch.getId(), "time")) {
                    flushed++;
                }
            } catch (Exception e) {
                log.error("Failed to flush batch {}: {}", batch.getId(), e.getMessage(), e);
            }
        }

        deliveryService.recoverStalled(now);
        deliveryService.retryDue(now);
        if (flushed > 0) {
            log.info("Flushed {} due batch(es)", flushed);
        }
        return flushed;
    }

    public NotificationBatch getBatch(String batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new EntityNotFoundException("NotificationBatch", batchId));
    }

    public List<NotificationBatch> getBatches(BatchStatus status) {
        return batchRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    public List<NotificationBatch> getBatchesForKey(String batchKey) {
        return batchRepository.findByBatchKeyOrderByCreatedAtDesc(batchKey);
    }

    public BatchStatistics getStatistics() {
        Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
        for (Object[] row : batchRepository.countByBatchKeyAndStatus()) {
            String batchKey = (String) row[0];
            BatchStatus status = (BatchStatus) row[1];
            long count = ((Number) row[2]).longValue();
            counts.computeIfAbsent(batchKey, k -> new LinkedHashMap<>())
                    .put(status.name().toLowerCase(Locale.ROOT), count);
        }
        List<NotificationBatch> pending = batchRepository.findByStatusOrderByCreatedAtDesc(BatchStatus.PENDING);
        return BatchStatistics.builder()
                .batchesByKeyAndStatus(counts)
                .pendingBatches(pending.size())
                .pendingNotifications(pending.stream().mapToLong(NotificationBatch::size).sum())
                .deferredEvents(deferredQueue.size())
                .activeConfigurations(configRepository.findByActiveTrueOrderByBatchKeyAsc().size())
                .build();
    }

    /**
     * Deletes processed and failed batches created before the retention window.
     */
    public int cleanup() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getBatching().getRetentionDays()));
        int deleted = batchRepository.deleteByStatusInAndCreatedAtBefore(
                List.of(BatchStatus.PROCESSED, BatchStatus.FAILED), cutoff);
        if (deleted > 0) {
            log.info("Removed {} delivered or failed batch(es) older than {}", deleted, cutoff);
        }
        return deleted;
    }
}
