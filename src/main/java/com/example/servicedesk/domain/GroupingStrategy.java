package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How events sharing a batch key are split into separate batches.
 */
public enum GroupingStrategy {
    USER, TICKET, TYPE, PRIORITY, CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GroupingStrategy fromWireName(String value) {
        if (value == null) return null;
        return GroupingStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
