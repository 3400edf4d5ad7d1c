package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Notification priority, ordered from least to most urgent.
 */
public enum NotificationPriority {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationPriority fromWireName(String value) {
        return parse(value).orElse(null);
    }

    public static Optional<NotificationPriority> parse(Object value) {
        if (value instanceof NotificationPriority priority) {
            return Optional.of(priority);
        }
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim().toUpperCase(Locale.ROOT);
        for (NotificationPriority priority : values()) {
            if (priority.name().equals(text)) {
                return Optional.of(priority);
            }
        }
        return Optional.empty();
    }

    public boolean isAtLeast(NotificationPriority other) {
        return compareTo(other) >= 0;
    }

    /** One level up, saturating at CRITICAL. */
    public NotificationPriority raised() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }
}
