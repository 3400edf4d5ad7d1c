package com.example.servicedesk.domain;

import com.example.servicedesk.domain.json.EscalationActionListConverter;
import com.example.servicedesk.domain.json.EscalationConditionListConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Defines when a ticket escalates and what each escalation cycle does.
 */
@Entity
@Table(name = "escalation_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Convert(converter = EscalationConditionListConverter.class)
    @Column(name = "conditions", length = 8192)
    @Builder.Default
    private List<EscalationCondition> conditions = new ArrayList<>();

    /** Ordered steps run on every escalation cycle */
    @Convert(converter = EscalationActionListConverter.class)
    @Column(name = "actions", length = 8192)
    @Builder.Default
    private List<EscalationAction> actions = new ArrayList<>();

    @Builder.Default
    private int priority = 100;

    @Column(name = "cooldown_period_minutes")
    @Builder.Default
    private int cooldownPeriodMinutes = 15;

    @Column(name = "max_escalations")
    @Builder.Default
    private int maxEscalations = 1;

    @Builder.Default
    private boolean active = true;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
