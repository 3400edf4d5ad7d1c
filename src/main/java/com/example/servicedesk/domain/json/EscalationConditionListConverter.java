package com.example.servicedesk.domain.json;

import com.example.servicedesk.domain.EscalationCondition;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class EscalationConditionListConverter extends JsonAttributeConverter<List<EscalationCondition>> {

    public EscalationConditionListConverter() {
        super(new TypeReference<List<EscalationCondition>>() {});
    }

    @Override
    protected List<EscalationCondition> empty() {
        return new ArrayList<>();
    }
}
