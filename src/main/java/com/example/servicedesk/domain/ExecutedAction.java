package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry for one action step run by an escalation cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExecutedAction {
    private String actionType;
    private int escalationLevel;
    private Instant executedAt;
    private boolean success;
    private Map<String, Object> result;
    private String error;
    private int retryCount;
}
