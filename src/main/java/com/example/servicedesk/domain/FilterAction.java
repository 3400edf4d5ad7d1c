package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FilterAction {
    BLOCK, ALLOW, DELAY, MODIFY, PRIORITY_CHANGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FilterAction fromWireName(String value) {
        if (value == null) return null;
        return FilterAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
