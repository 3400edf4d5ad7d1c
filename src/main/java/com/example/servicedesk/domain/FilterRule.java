package com.example.servicedesk.domain;

import com.example.servicedesk.domain.json.FilterConditionListConverter;
import com.example.servicedesk.domain.json.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin-owned rule deciding what happens to a notification event.
 * Rules are evaluated by ascending priority, ties broken by id; the first match wins.
 */
@Entity
@Table(name = "filter_rules", indexes = {
        @Index(name = "idx_filter_rule_active_priority", columnList = "active, priority")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    /** AND-combined predicates over event fields */
    @Convert(converter = FilterConditionListConverter.class)
    @Column(name = "conditions", length = 8192)
    @Builder.Default
    private List<FilterCondition> conditions = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FilterAction action;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "action_params", length = 4096)
    @Builder.Default
    private Map<String, Object> actionParams = new LinkedHashMap<>();

    /** Lower evaluates first */
    @Builder.Default
    private int priority = 100;

    @Builder.Default
    private boolean active = true;

    /** Set for a user-scoped rule, null for a global one */
    @Column(name = "owner_user_id")
    private String ownerUserId;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
