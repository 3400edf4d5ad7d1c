package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscalationCondition {

    /** time_based, priority, min_priority, event_type */
    private String type;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();
}
