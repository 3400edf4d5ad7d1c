package com.example.servicedesk.escalation;

import java.util.Map;

/**
 * Result of one attempt at an action step.
 */
public record ActionOutcome(boolean success, Map<String, Object> result, String error) {

    public static ActionOutcome success(Map<String, Object> result) {
        return new ActionOutcome(true, result, null);
    }

    public static ActionOutcome failure(String error) {
        return new ActionOutcome(false, Map.of(), error);
    }
}
