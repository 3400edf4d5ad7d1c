package com.example.servicedesk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One predicate of a filter rule: field, operator, value.
 * The operator is kept as text so a malformed rule can still be loaded and skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FilterCondition {
    private String field;
    private String operator;
    private Object value;
}
