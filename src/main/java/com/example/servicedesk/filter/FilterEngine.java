package com.example.servicedesk.filter;

import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.FilterCondition;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.exception.RuleConfigurationException;
import com.example.servicedesk.repository.FilterRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Filter Engine - decides whether an event is blocked, allowed, delayed or rewritten
 * before it reaches batching.
 *
 * Active rules are evaluated by ascending priority, ties broken by rule id, and the first
 * rule whose conditions all hold decides. A rule that cannot be evaluated is logged and
 * skipped; with no match the event is allowed unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterEngine {

    static final Comparator<FilterRule> EVALUATION_ORDER = Comparator
            .comparingInt(FilterRule::getPriority)
            .thenComparing(FilterRule::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final FilterRuleRepository filterRuleRepository;
    private final ConditionEvaluator conditionEvaluator;
    private final NotificationEngineProperties properties;

    public FilterDecision evaluate(NotificationEvent event) {
        return evaluate(event, filterRuleRepository.findByActiveTrueOrderByPriorityAscIdAsc());
    }

    /**
     * Evaluates against the supplied rules without touching any state.
     */
    public FilterDecision evaluate(NotificationEvent event, List<FilterRule> rules) {
        List<FilterRule> ordered = rules.stream()
                .filter(FilterRule::isActive)
                .filter(rule -> appliesToRecipients(rule, event))
                .sorted(EVALUATION_ORDER)
                .toList();

        for (FilterRule rule : ordered) {
            try {
                if (matchesAll(rule, event)) {
                    FilterDecision decision = decide(rule, event);
                    log.debug("Event {} ({}) matched filter rule '{}' -> {}",
                            event.getId(), event.getType(), rule.getName(), decision.getAction());
                    return decision;
                }
            } catch (RuleConfigurationException e) {
                log.warn("Skipping malformed filter rule '{}' ({}): {}", rule.getName(), rule.getId(), e.getMessage());
            }
        }
        return FilterDecision.allowByDefault(event);
    }

    private boolean appliesToRecipients(FilterRule rule, NotificationEvent event) {
        if (rule.getOwnerUserId() == null) {
            return true;
        }
        return event.getTargetUserIds() != null && event.getTargetUserIds().contains(rule.getOwnerUserId());
    }

    private boolean matchesAll(FilterRule rule, NotificationEvent event) {
        List<FilterCondition> conditions = rule.getConditions() != null ? rule.getConditions() : List.of();
        for (FilterCondition condition : conditions) {
            if (!conditionEvaluator.matches(condition, event)) {
                return false;
            }
        }
        return true;
    }

    private FilterDecision decide(FilterRule rule, NotificationEvent event) {
        if (rule.getAction() == null) {
            throw new RuleConfigurationException("Filter rule has no action");
        }
        Map<String, Object> params = rule.getActionParams() != null ? rule.getActionParams() : Map.of();
        FilterDecision.FilterDecisionBuilder decision = FilterDecision.builder()
                .action(rule.getAction())
                .ruleId(rule.getId())
                .ruleName(rule.getName());

        switch (rule.getAction()) {
            case BLOCK -> decision.event(null);
            case ALLOW -> decision.event(event);
            case DELAY -> decision.event(event).delayUntil(delayUntil(event, params));
            case MODIFY -> {
                NotificationEvent modified = modify(event, params);
                decision.event(modified).modifiedEvent(modified);
            }
            case PRIORITY_CHANGE -> {
                NotificationEvent modified = copyOf(event);
                modified.setPriority(resolvePriority(params.get("newPriority"), event.getPriority()));
                decision.event(modified).modifiedEvent(modified);
            }
        }
        return decision.build();
    }

    private Instant delayUntil(NotificationEvent event, Map<String, Object> params) {
        // Anchored to the event time so the same event always gets the same decision
        if (event.getOccurredAt() == null) {
            throw new RuleConfigurationException("Cannot delay an event without occurredAt");
        }
        try {
            Duration delay;
            if (params.containsKey("delayMs")) {
                delay = Duration.ofMillis(requireNonNegative(params.get("delayMs"), "delayMs"));
            } else if (params.containsKey("delayMinutes")) {
                delay = Duration.ofMinutes(requireNonNegative(params.get("delayMinutes"), "delayMinutes"));
            } else {
                delay = Duration.ofMinutes(properties.getFilter().getDefaultDelayMinutes());
            }
            return event.getOccurredAt().plus(delay);
        } catch (ArithmeticException | DateTimeException e) {
            throw new RuleConfigurationException("Delay out of range: " + e.getMessage());
        }
    }

    private NotificationEvent modify(NotificationEvent event, Map<String, Object> params) {
        NotificationEvent modified = copyOf(event);
        if (params.containsKey("newPriority")) {
            modified.setPriority(resolvePriority(params.get("newPriority"), event.getPriority()));
        }
        Object payload = params.get("payload");
        if (payload != null) {
            if (!(payload instanceof Map<?, ?> overrides)) {
                throw new RuleConfigurationException("modify payload must be an object, got " + payload);
            }
            overrides.forEach((key, value) -> modified.getPayload().put(String.valueOf(key), value));
        }
        Object batchable = params.get("setBatchable");
        if (batchable != null) {
            if (!(batchable instanceof Boolean flag)) {
                throw new RuleConfigurationException("setBatchable must be a boolean, got " + batchable);
            }
            modified.setBatchable(flag);
        }
        Object batchKey = params.get("batchKey");
        if (batchKey != null) {
            modified.setBatchKey(batchKey.toString());
        }
        return modified;
    }

    private NotificationPriority resolvePriority(Object requested, NotificationPriority original) {
        return NotificationPriority.parse(requested).orElseGet(() -> {
            log.warn("Ignoring invalid priority '{}', keeping {}", requested, original);
            return original;
        });
    }

    private static long requireNonNegative(Object value, String name) {
        if (!(value instanceof Number number) || number.longValue() < 0) {
            throw new RuleConfigurationException(name + " must be a non-negative number, got " + value);
        }
        return number.longValue();
    }

    private static NotificationEvent copyOf(NotificationEvent event) {
        return event.toBuilder()
                .targetUserIds(new ArrayList<>(event.getTargetUserIds() != null ? event.getTargetUserIds() : List.of()))
                .payload(new LinkedHashMap<>(event.getPayload() != null ? event.getPayload() : Map.of()))
                .build();
    }
}
