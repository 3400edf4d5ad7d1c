package com.example.servicedesk.domain;

import com.example.servicedesk.domain.json.StringSetConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Grouping and flush policy for one logical notification stream.
 * Changed only through configuration, never by the engine.
 */
@Entity
@Table(name = "batch_configurations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchConfiguration {

    @Id
    @Column(name = "batch_key")
    private String batchKey;

    @Column(length = 1024)
    private String description;

    @Column(name = "max_batch_size", nullable = false)
    private int maxBatchSize;

    @Column(name = "max_wait_time_ms", nullable = false)
    private long maxWaitTimeMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "group_by", nullable = false)
    private GroupingStrategy groupBy;

    @Column(name = "custom_grouper_id")
    private String customGrouperId;

    /** Event types routed to this batch key */
    @Convert(converter = StringSetConverter.class)
    @Column(name = "event_types", length = 2048)
    @Builder.Default
    private Set<String> eventTypes = new LinkedHashSet<>();

    @Builder.Default
    private boolean active = true;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
