package com.example.servicedesk.config;

import com.example.servicedesk.domain.BatchConfiguration;
import com.example.servicedesk.domain.EscalationRule;
import com.example.servicedesk.domain.FilterRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape of the defaults YAML file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationDefaults {
    private List<BatchConfiguration> batchConfigurations = new ArrayList<>();
    private List<FilterRule> filterRules = new ArrayList<>();
    private List<EscalationRule> escalationRules = new ArrayList<>();
}
