package com.example.servicedesk.exception;

import java.util.List;

/**
 * Rejected admin change to a rule or batch configuration.
 */
public class InvalidConfigurationException extends NotificationEngineException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations), "INVALID_CONFIGURATION");
        this.violations = List.copyOf(violations);
    }

    public InvalidConfigurationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
