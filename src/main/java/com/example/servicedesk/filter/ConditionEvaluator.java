package com.example.servicedesk.filter;

import com.example.servicedesk.domain.FilterCondition;
import com.example.servicedesk.domain.NotificationEvent;
import com.example.servicedesk.exception.RuleConfigurationException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Interprets filter conditions (field, operator, value) against an event.
 *
 * Supported fields: type, priority, ticketId, authorId, content (lower-cased title and message),
 * targetUserId (multi-valued), occurredAt (epoch millis), hourOfDay (UTC) and payload.&lt;key&gt;.
 *
 * Evaluation is a pure function of the condition and the event. A condition that cannot be
 * evaluated raises {@link RuleConfigurationException}.
 */
@Component
public class ConditionEvaluator {

    private static final String PAYLOAD_PREFIX = "payload.";

    private final Cache<String, Pattern> patternCache = Caffeine.newBuilder()
            .maximumSize(500)
            .build();

    public boolean matches(FilterCondition condition, NotificationEvent event) {
        if (condition == null) {
            throw new RuleConfigurationException("Null condition");
        }
        String field = condition.getField();
        if (field == null || field.isBlank()) {
            throw new RuleConfigurationException("Condition field is missing");
        }
        ConditionOperator operator = ConditionOperator.fromName(condition.getOperator());
        Object expected = condition.getValue();

        if ("targetUserId".equals(field)) {
            List<String> targets = event.getTargetUserIds() != null ? event.getTargetUserIds() : List.of();
            if (targets.isEmpty()) {
                return apply(operator, null, expected);
            }
            return operator.isNegated()
                    ? targets.stream().allMatch(target -> apply(operator, target, expected))
                    : targets.stream().anyMatch(target -> apply(operator, target, expected));
        }
        return apply(operator, resolveField(field, event), expected);
    }

    Object resolveField(String field, NotificationEvent event) {
        switch (field) {
            case "type":
                return event.getType();
            case "priority":
                return event.getPriority() != null ? event.getPriority().wireName() : null;
            case "ticketId":
                return event.getTicketId();
            case "authorId":
                return event.getAuthorId();
            case "content":
                String title = event.getTitle() != null ? event.getTitle() : "";
                String message = event.getMessage() != null ? event.getMessage() : "";
                return (title + " " + message).trim().toLowerCase(Locale.ROOT);
            case "occurredAt":
                return event.getOccurredAt() != null ? event.getOccurredAt().toEpochMilli() : null;
            case "hourOfDay":
                return event.getOccurredAt() != null
                        ? event.getOccurredAt().atZone(ZoneOffset.UTC).getHour() : null;
            default:
                if (field.startsWith(PAYLOAD_PREFIX)) {
                    String key = field.substring(PAYLOAD_PREFIX.length());
                    return event.getPayload() != null ? event.getPayload().get(key) : null;
                }
                throw new RuleConfigurationException("Unknown condition field: " + field);
        }
    }

    private boolean apply(ConditionOperator operator, Object actual, Object expected) {
        return switch (operator) {
            case EQUALS -> valuesEqual(actual, expected);
            case NOT_EQUALS -> !valuesEqual(actual, expected);
            case CONTAINS -> actual != null && asText(actual).contains(requireText(expected, operator));
            case NOT_CONTAINS -> actual == null || !asText(actual).contains(requireText(expected, operator));
            case STARTS_WITH -> actual != null && asText(actual).startsWith(requireText(expected, operator));
            case ENDS_WITH -> actual != null && asText(actual).endsWith(requireText(expected, operator));
            case IN -> requireCollection(expected, operator).stream().anyMatch(v -> valuesEqual(actual, v));
            case NOT_IN -> requireCollection(expected, operator).stream().noneMatch(v -> valuesEqual(actual, v));
            case GREATER_THAN -> {
                BigDecimal bound = requireNumber(expected, operator);
                BigDecimal value = asNumber(actual);
                yield value != null && value.compareTo(bound) > 0;
            }
            case LESS_THAN -> {
                BigDecimal bound = requireNumber(expected, operator);
                BigDecimal value = asNumber(actual);
                yield value != null && value.compareTo(bound) < 0;
            }
            case BETWEEN -> {
                Collection<?> range = requireCollection(expected, operator);
                if (range.size() != 2) {
                    throw new RuleConfigurationException("between expects [low, high], got " + expected);
                }
                Object[] bounds = range.toArray();
                BigDecimal low = requireNumber(bounds[0], operator);
                BigDecimal high = requireNumber(bounds[1], operator);
                BigDecimal value = asNumber(actual);
                yield value != null && value.compareTo(low) >= 0 && value.compareTo(high) <= 0;
            }
            case REGEX -> actual != null && compile(requireText(expected, operator)).matcher(asText(actual)).find();
        };
    }

    private Pattern compile(String regex) {
        try {
            return patternCache.get(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw new RuleConfigurationException("Invalid regex: " + regex, e);
        }
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == null && expected == null;
        }
        BigDecimal left = asNumber(actual);
        BigDecimal right = asNumber(expected);
        if (actual instanceof Number && right != null) {
            return left.compareTo(right) == 0;
        }
        if (expected instanceof Number && left != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(asText(actual), asText(expected));
    }

    private static String asText(Object value) {
        return value instanceof Enum<?> e ? e.name().toLowerCase(Locale.ROOT) : String.valueOf(value);
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String requireText(Object expected, ConditionOperator operator) {
        if (!(expected instanceof String text)) {
            throw new RuleConfigurationException(operator + " expects a string value, got " + expected);
        }
        return text;
    }

    private static Collection<?> requireCollection(Object expected, ConditionOperator operator) {
        if (!(expected instanceof Collection<?> values)) {
            throw new RuleConfigurationException(operator + " expects a list value, got " + expected);
        }
        return values;
    }

    private static BigDecimal requireNumber(Object expected, ConditionOperator operator) {
        BigDecimal number = expected instanceof Number || expected instanceof String ? asNumber(expected) : null;
        if (number == null) {
            throw new RuleConfigurationException(operator + " expects a numeric value, got " + expected);
        }
        return number;
    }
}
