package com.example.servicedesk.escalation;

import java.util.Locale;
import java.util.Optional;

public enum EscalationConditionType {
    /** parameters: types (list) or type */
    EVENT_TYPE,
    /** parameters: priority, matched exactly */
    PRIORITY,
    /** parameters: priority, matched at or above */
    MIN_PRIORITY,
    /** parameters: timeoutMinutes until the first escalation cycle */
    TIME_BASED;

    public static Optional<EscalationConditionType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
