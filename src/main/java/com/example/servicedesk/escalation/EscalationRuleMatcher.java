package com.example.servicedesk.escalation;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.EscalationCondition;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which escalation rules an incoming ticket event starts, and when their first cycle is due.
 * All of a rule's conditions must hold. A rule with an unknown or malformed condition never matches.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EscalationRuleMatcher {

    private final NotificationEngineProperties properties;

    public boolean matches(EscalationRule rule, NotificationEvent event) {
        List<EscalationCondition> conditions = rule.getConditions() != null ? rule.getConditions() : List.of();
        // A rule without filtering conditions is only started by an explicit trigger
        boolean filtered = false;
        for (EscalationCondition condition : conditions) {
            Optional<EscalationConditionType> type = EscalationConditionType.parse(condition.getType());
            if (type.isEmpty()) {
                log.warn("Escalation rule '{}' has unknown condition type '{}'", rule.getName(), condition.getType());
                return false;
            }
            Map<String, Object> params = condition.getParameters() != null ? condition.getParameters() : Map.of();
            switch (type.get()) {
                case EVENT_TYPE -> {
                    filtered = true;
                    if (!eventTypes(params).contains(event.getType())) {
                        return false;
                    }
                }
                case PRIORITY -> {
                    filtered = true;
                    Optional<NotificationPriority> wanted = NotificationPriority.parse(params.get("priority"));
                    if (wanted.isEmpty() || event.getPriority() != wanted.get()) {
                        return false;
                    }
                }
                case MIN_PRIORITY -> {
                    filtered = true;
                    Optional<NotificationPriority> floor = NotificationPriority.parse(params.get("priority"));
                    if (floor.isEmpty() || event.getPriority() == null || !event.getPriority().isAtLeast(floor.get())) {
                        return false;
                    }
                }
                case TIME_BASED -> {
                    // only schedules the first cycle
                }
            }
        }
        return filtered;
    }

    /**
     * The time_based timeout if the rule has one, otherwise the configured default trigger delay.
     */
    public Instant firstActionAt(EscalationRule rule, Instant now) {
        List<EscalationCondition> conditions = rule.getConditions() != null ? rule.getConditions() : List.of();
        for (EscalationCondition condition : conditions) {
            if (EscalationConditionType.parse(condition.getType()).orElse(null) == EscalationConditionType.TIME_BASED
                    && condition.getParameters() != null
                    && condition.getParameters().get("timeoutMinutes") instanceof Number minutes) {
                return now.plus(Duration.ofMinutes(Math.max(0, minutes.longValue())));
            }
        }
        return now.plus(Duration.ofMinutes(properties.getEscalation().getDefaultTriggerDelayMinutes()));
    }

    private static List<String> eventTypes(Map<String, Object> params) {
        if (params.get("types") instanceof Collection<?> types) {
            return types.stream().map(String::valueOf).toList();
        }
        Object single = params.get("type");
        return single != null ? List.of(single.toString()) : List.of();
    }
}
