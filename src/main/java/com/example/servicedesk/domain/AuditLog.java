package com.example.servicedesk.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry for engine decisions and state transitions.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_target", columnList = "target"),
        @Index(name = "idx_audit_timestamp", columnList = "logged_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** "filter-engine", "batching-engine", "delivery", "escalation-manager", "ticketing", or the admin from X-Actor */
    @Column(nullable = false)
    private String actor;

    /** NOTIFICATION_BLOCKED, BATCH_FLUSHED, BATCH_DELIVERED, BATCH_DELIVERY_FAILED,
     *  ESCALATION_PENDING, ESCALATION_COMPLETED, ESCALATION_FAILED, ESCALATION_CANCELLED, TICKET_CLOSED,
     *  USER_PREFERENCES_UPDATED, USER_PREFERENCES_DELETED,
     *  and FILTER_RULE_, BATCH_CONFIG_, ESCALATION_RULE_ followed by CREATED, UPDATED or DELETED */
    @Column(nullable = false)
    private String action;

    /** Event id, batch id or escalation instance id */
    private String target;

    /** JSON details about the action */
    @Column(length = 8192)
    private String details;

    @Builder.Default
    private boolean success = true;

    @Column(name = "logged_at", nullable = false)
    private Instant timestamp;
}
