package com.example.servicedesk.domain;

import com.example.servicedesk.domain.json.ExecutedActionListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime state of one rule escalating one subject (ticket).
 * At most one PENDING/EXECUTING instance exists per (ruleId, subjectId).
 */
@Entity
@Table(name = "escalation_instances", indexes = {
        @Index(name = "idx_escalation_rule_subject", columnList = "rule_id, subject_id, status"),
        @Index(name = "idx_escalation_status_next", columnList = "status, next_action_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationInstance {

    @Id
    private String id;

    /** The originating event, or the subject itself for a manual trigger */
    @Column(name = "notification_id")
    private String notificationId;

    @Column(name = "subject_id", nullable = false)
    private String subjectId;

    @Column(name = "rule_id", nullable = false)
    private String ruleId;

    @Column(name = "escalation_level", nullable = false)
    @Builder.Default
    private int escalationLevel = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EscalationStatus status;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    @Column(name = "last_action_at")
    private Instant lastActionAt;

    @Column(name = "next_action_at")
    private Instant nextActionAt;

    /** Append-only */
    @Convert(converter = ExecutedActionListConverter.class)
    @Lob
    @Column(name = "executed_actions")
    @Builder.Default
    private List<ExecutedAction> executedActions = new ArrayList<>();

    @Column(name = "status_reason", length = 1024)
    private String statusReason;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Bumped by every write, including the bulk cancel, so a stale cycle commit is rejected */
    @Version
    private Long version;
}
