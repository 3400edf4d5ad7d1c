package com.example.servicedesk.repository;

import com.example.servicedesk.domain.BatchStatus;
import com.example.servicedesk.domain.NotificationBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationBatchRepository extends JpaRepository<NotificationBatch, String> {

    Optional<NotificationBatch> findFirstByBatchKeyAndGroupKeyAndStatusOrderByCreatedAtDesc(
            String batchKey, String groupKey, BatchStatus status);

    List<NotificationBatch> findByStatusAndScheduledAtLessThanEqualOrderByScheduledAtAsc(
            BatchStatus status, Instant deadline);

    List<NotificationBatch> findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(
            BatchStatus status, Instant deadline);

    List<NotificationBatch> findByStatusAndUpdatedAtLessThanEqualOrderByUpdatedAtAsc(
            BatchStatus status, Instant cutoff);

    List<NotificationBatch> findByStatusOrderByCreatedAtDesc(BatchStatus status);

    List<NotificationBatch> findByBatchKeyOrderByCreatedAtDesc(String batchKey);

    /**
     * Atomic single-row status transition. Returns 0 when the batch is no longer in {@code expected}.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE NotificationBatch b SET b.status = :target, b.updatedAt = :at " +
           "WHERE b.id = :id AND b.status = :expected")
    int transitionStatus(String id, BatchStatus expected, BatchStatus target, Instant at);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE NotificationBatch b SET b.status = com.example.servicedesk.domain.BatchStatus.PROCESSED, b.processedAt = :at, b.updatedAt = :at, " +
           "b.deliveryAttempts = b.deliveryAttempts + 1, b.nextRetryAt = NULL, b.lastError = NULL " +
           "WHERE b.id = :id AND b.status = com.example.servicedesk.domain.BatchStatus.READY")
    int markProcessed(String id, Instant at);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE NotificationBatch b SET b.status = com.example.servicedesk.domain.BatchStatus.FAILED, b.deliveryAttempts = :attempts, " +
           "b.nextRetryAt = :nextRetryAt, b.lastError = :error, b.updatedAt = :at " +
           "WHERE b.id = :id AND b.status = com.example.servicedesk.domain.BatchStatus.READY")
    int markFailed(String id, int attempts, Instant nextRetryAt, String error, Instant at);

    /** Moves a retry-eligible failed batch back to READY. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE NotificationBatch b SET b.status = com.example.servicedesk.domain.BatchStatus.READY, b.nextRetryAt = NULL, b.updatedAt = :at " +
           "WHERE b.id = :id AND b.status = com.example.servicedesk.domain.BatchStatus.FAILED AND b.nextRetryAt IS NOT NULL")
    int requeueFailed(String id, Instant at);

    @Query("SELECT b.batchKey, b.status, COUNT(b) FROM NotificationBatch b GROUP BY b.batchKey, b.status " +
           "ORDER BY b.batchKey, b.status")
    List<Object[]> countByBatchKeyAndStatus();

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM NotificationBatch b WHERE b.status IN :statuses AND b.createdAt < :cutoff")
    int deleteByStatusInAndCreatedAtBefore(Collection<BatchStatus> statuses, Instant cutoff);
}
