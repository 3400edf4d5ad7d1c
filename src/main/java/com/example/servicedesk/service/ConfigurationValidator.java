package com.example.servicedesk.service;

import com.example.servicedesk.batching.CustomGrouperRegistry;
import com.example.servicedesk.config.NotificationEngineProperties;
import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.EscalationAction;
import com.example.servicedesk.domain.EscalationCondition;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.FilterAction;
import com.example.servicedesk.domain.FilterCondition;
import com.example.servicedesk.domain.FilterRule;
import com.example.servicedesk.domain.GroupingStrategy;
import com.example.servicedesk.domain.NotificationPriority;
import com.example.servicedesk.domain.UserNotificationPreferences;
import com.example.servicedesk.escalation.EscalationActionRegistry;
import com.example.servicedesk.escalation.EscalationConditionType;
import com.example.servicedesk.exception.InvalidConfigurationException;
import com.example.servicedesk.exception.RuleConfigurationException;
import com.example.servicedesk.filter.ConditionOperator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Checks admin changes before they are stored. Collects every violation and
 * throws {@link InvalidConfigurationException} listing them.
 */
@Component
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final CustomGrouperRegistry grouperRegistry;
    private final EscalationActionRegistry actionRegistry;
    private final NotificationEngineProperties properties;

    public void validate(FilterRule rule) {
        List<String> violations = new ArrayList<>();
        requireName(rule.getName(), violations);
        if (rule.getAction() == null) {
            violations.add("action is required");
        }
        List<FilterCondition> conditions = rule.getConditions() != null ? rule.getConditions() : List.of();
        for (int i = 0; i < conditions.size(); i++) {
            FilterCondition condition = conditions.get(i);
            if (condition == null || condition.getField() == null || condition.getField().isBlank()) {
                violations.add("conditions[" + i + "].field is required");
                continue;
            }
            try {
                ConditionOperator.fromName(condition.getOperator());
            } catch (RuleConfigurationException e) {
                violations.add("conditions[" + i + "]: " + e.getMessage());
            }
        }

        Map<String, Object> params = rule.getActionParams() != null ? rule.getActionParams() : Map.of();
        if (rule.getAction() == FilterAction.DELAY) {
            long maxMinutes = properties.getFilter().getMaxDelayMinutes();
            checkDelay(params.get("delayMinutes"), "delayMinutes", maxMinutes, violations);
            checkDelay(params.get("delayMs"), "delayMs", TimeUnit.MINUTES.toMillis(maxMinutes), violations);
        }
        if (rule.getAction() == FilterAction.PRIORITY_CHANGE
                && NotificationPriority.parse(params.get("newPriority")).isEmpty()) {
            violations.add("actionParams.newPriority must be one of low, medium, high, critical");
        }
        if (rule.getAction() == FilterAction.MODIFY && params.get("payload") != null
                && !(params.get("payload") instanceof Map)) {
            violations.add("actionParams.payload must be an object");
        }
        throwIfAny(violations);
    }

    public void validate(BatchConfiguration config) {
        List<String> violations = new ArrayList<>();
        if (config.getBatchKey() == null || config.getBatchKey().isBlank()) {
            violations.add("batchKey is required");
        }
        if (config.getMaxBatchSize() < 1) {
            violations.add("maxBatchSize must be >= 1");
        }
        if (config.getMaxWaitTimeMs() < 0) {
            violations.add("maxWaitTimeMs must be >= 0");
        }
        if (config.getGroupBy() == null) {
            violations.add("groupBy is required");
        } else if (config.getGroupBy() == GroupingStrategy.CUSTOM) {
            if (config.getCustomGrouperId() == null || config.getCustomGrouperId().isBlank()) {
                violations.add("customGrouperId is required when groupBy is custom");
            } else if (!grouperRegistry.isRegistered(config.getCustomGrouperId())) {
                violations.add("customGrouperId '" + config.getCustomGrouperId() + "' is not registered; known: "
                        + grouperRegistry.getIds());
            }
        }
        throwIfAny(violations);
    }

    public void validate(EscalationRule rule) {
        List<String> violations = new ArrayList<>();
        requireName(rule.getName(), violations);
        if (rule.getMaxEscalations() < 1) {
            violations.add("maxEscalations must be >= 1");
        }
        if (rule.getCooldownPeriodMinutes() < 0) {
            violations.add("cooldownPeriodMinutes must be >= 0");
        }
        List<EscalationCondition> conditions = rule.getConditions() != null ? rule.getConditions() : List.of();
        for (int i = 0; i < conditions.size(); i++) {
            String type = conditions.get(i) != null ? conditions.get(i).getType() : null;
            if (EscalationConditionType.parse(type).isEmpty()) {
                violations.add("conditions[" + i + "].type '" + type + "' is not supported");
            }
        }
        List<EscalationAction> actions = rule.getActions() != null ? rule.getActions() : List.of();
        for (int i = 0; i < actions.size(); i++) {
            String type = actions.get(i) != null ? actions.get(i).getType() : null;
            if (!actionRegistry.isSupported(type)) {
                violations.add("actions[" + i + "].type '" + type + "' is not supported");
            }
        }
        throwIfAny(violations);
    }

    public void validate(UserNotificationPreferences preferences) {
        List<String> violations = new ArrayList<>();
        if (preferences.getUserId() == null || preferences.getUserId().isBlank()) {
            violations.add("userId is required");
        }
        if (preferences.getTimezone() != null) {
            try {
                ZoneId.of(preferences.getTimezone());
            } catch (DateTimeException e) {
                violations.add("timezone '" + preferences.getTimezone() + "' is not a known zone");
            }
        }
        if (preferences.isQuietHoursEnabled()
                && (preferences.getQuietHoursStart() == null || preferences.getQuietHoursEnd() == null)) {
            violations.add("quietHoursStart and quietHoursEnd are required when quiet hours are enabled");
        }
        if (preferences.isWorkingHoursEnabled()) {
            if (preferences.getWorkingHoursStart() == null || preferences.getWorkingHoursEnd() == null) {
                violations.add("workingHoursStart and workingHoursEnd are required when working hours are enabled");
            } else if (!preferences.getWorkingHoursStart().isBefore(preferences.getWorkingHoursEnd())) {
                violations.add("workingHoursStart must be before workingHoursEnd");
            }
            if (preferences.getWorkingDays() == null || preferences.getWorkingDays().isEmpty()) {
                violations.add("workingDays must not be empty when working hours are enabled");
            }
        }
        if (preferences.getMaxPerHour() != null && preferences.getMaxPerHour() < 1) {
            violations.add("maxPerHour must be >= 1");
        }
        if (preferences.getMaxPerDay() != null && preferences.getMaxPerDay() < 1) {
            violations.add("maxPerDay must be >= 1");
        }
        if (preferences.getChannels() != null) {
            preferences.getChannels().forEach((channel, channelPreference) -> {
                if (channel == null || channel.isBlank() || channelPreference == null) {
                    violations.add("channels must map a channel name to its settings");
                }
            });
        }
        throwIfAny(violations);
    }

    private static void checkDelay(Object value, String key, long max, List<String> violations) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Number n) || n.longValue() < 0) {
            violations.add("actionParams." + key + " must be a non-negative number");
        } else if (n.longValue() > max) {
            violations.add("actionParams." + key + " must be at most " + max);
        }
    }

    private static void requireName(String name, List<String> violations) {
        if (name == null || name.isBlank()) {
            violations.add("name is required");
        }
    }

    private static void throwIfAny(List<String> violations) {
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
    }
}
