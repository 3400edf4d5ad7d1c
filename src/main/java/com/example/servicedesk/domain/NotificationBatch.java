package com.example.servicedesk.domain;

import com.example.servicedesk.domain.json.NotificationEventListConverter;
import com.example.servicedesk.domain.json.StringSetConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Events accumulated for one (batchKey, groupKey) pair.
 * Owned by the engine until PROCESSED or FAILED, immutable history afterwards.
 * The id doubles as the delivery idempotency key.
 */
@Entity
@Table(name = "notification_batches", indexes = {
        @Index(name = "idx_batch_group_status", columnList = "batch_key, group_key, status"),
        @Index(name = "idx_batch_status_scheduled", columnList = "status, scheduled_at"),
        @Index(name = "idx_batch_status_retry", columnList = "status, next_retry_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationBatch {

    @Id
    private String id;

    @Column(name = "batch_key", nullable = false)
    private String batchKey;

    @Column(name = "group_key", nullable = false)
    private String groupKey;

    /** Snapshots in submission order */
    @Convert(converter = NotificationEventListConverter.class)
    @Lob
    @Column(name = "notifications")
    @Builder.Default
    private List<NotificationEvent> notifications = new ArrayList<>();

    @Convert(converter = StringSetConverter.class)
    @Column(name = "target_user_ids", length = 65536)
    @Builder.Default
    private Set<String> targetUserIds = new LinkedHashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /** Flush deadline */
    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "delivery_attempts")
    @Builder.Default
    private int deliveryAttempts = 0;

    /** Set while a failed batch is still eligible for another delivery attempt */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "last_error", length = 2048)
    private String lastError;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public int size() {
        return notifications == null ? 0 : notifications.size();
    }
}
