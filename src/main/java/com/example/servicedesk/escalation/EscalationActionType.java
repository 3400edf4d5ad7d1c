package com.example.servicedesk.escalation;

import java.util.Locale;
import java.util.Optional;

public enum EscalationActionType {
    NOTIFY_USER,
    NOTIFY_ROLE,
    REASSIGN,
    RAISE_PRIORITY,
    CHANGE_CHANNELS,
    WEBHOOK;

    public static Optional<EscalationActionType> parse(String value) {
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
