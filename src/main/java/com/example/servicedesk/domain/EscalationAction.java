package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of an escalation cycle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscalationAction {

    /** notify_user, notify_role, reassign, raise_priority, change_channels, webhook */
    private String type;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
