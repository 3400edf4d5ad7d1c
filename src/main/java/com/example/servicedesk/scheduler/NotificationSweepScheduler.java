package com.example.servicedesk.scheduler;

import com.example.servicedesk.batching.BatchingEngine;
import com.example.servicedesk.escalation.EscalationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The one clock driving time-based work: batch deadlines, deferred releases,
 * delivery retries and escalation cycles. A sweep that is still running is
 * never started a second time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "service-desk.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NotificationSweepScheduler {

    private final BatchingEngine batchingEngine;
    private final EscalationManager escalationManager;

    private final AtomicBoolean batchSweepRunning = new AtomicBoolean(false);
    private final AtomicBoolean escalationSweepRunning = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${service-desk.scheduler.sweep-interval-ms:5000}")
    public void sweepBatches() {
        if (!batchSweepRunning.compareAndSet(false, true)) {
            log.debug("Batch sweep still running, skipping");
            return;
        }
        try {
            batchingEngine.flushDue();
        } catch (Exception e) {
            log.error("Batch sweep failed: {}", e.getMessage(), e);
        } finally {
            batchSweepRunning.set(false);
        }
    }

    @Scheduled(fixedDelayString = "${service-desk.scheduler.sweep-interval-ms:5000}")
    public void sweepEscalations() {
        if (!escalationSweepRunning.compareAndSet(false, true)) {
            log.debug("Escalation sweep still running, skipping");
            return;
        }
        try {
            escalationManager.tick();
        } catch (Exception e) {
            log.error("Escalation sweep failed: {}", e.getMessage(), e);
        } finally {
            escalationSweepRunning.set(false);
        }
    }

    @Scheduled(cron = "${service-desk.scheduler.cleanup-cron:0 0 * * * *}")
    public void cleanup() {
        try {
            int batches = batchingEngine.cleanup();
            int escalations = escalationManager.cleanup();
            log.debug("Cleanup removed {} batch(es) and {} escalation instance(s)", batches, escalations);
        } catch (Exception e) {
            log.error("Cleanup failed: {}", e.getMessage(), e);
        }
    }
}
