package com.example.servicedesk.subject;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TicketStatus {
    OPEN, IN_PROGRESS, WAITING, ACKNOWLEDGED, RESOLVED, CLOSED, DELETED;

    public boolean isOpen() {
        return this != CLOSED && this != DELETED;
    }

    public boolean isResolved() {
        return this == ACKNOWLEDGED || this == RESOLVED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TicketStatus fromWireName(String value) {
        if (value == null) return null;
        return TicketStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
