package com.example.servicedesk.filter;

import com.example.servicedesk.exception.RuleConfigurationException;

import java.util.Locale;

public enum ConditionOperator {
    EQUALS(false),
    NOT_EQUALS(true),
    CONTAINS(false),
    NOT_CONTAINS(true),
    STARTS_WITH(false),
    ENDS_WITH(false),
    IN(false),
    NOT_IN(true),
    GREATER_THAN(false),
    LESS_THAN(false),
    BETWEEN(false),
    REGEX(false);

    private final boolean negated;

    ConditionOperator(boolean negated) {
        this.negated = negated;
    }

    /**
     * Negated operators must hold for every value of a multi-valued field,
     * the others for at least one.
     */
    public boolean isNegated() {
        return negated;
    }

    public static ConditionOperator fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new RuleConfigurationException("Condition operator is missing");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Unknown condition operator: " + name);
        }
    }
}
