package com.example.servicedesk.exception;

/**
 * A stored rule cannot be evaluated (unknown operator, bad value shape, invalid regex, bad action params).
 * Evaluation skips the rule and moves on.
 */
public class RuleConfigurationException extends NotificationEngineException {

    public RuleConfigurationException(String message) {
        super(message, "RULE_CONFIGURATION_ERROR");
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, "RULE_CONFIGURATION_ERROR", cause);
    }
}
