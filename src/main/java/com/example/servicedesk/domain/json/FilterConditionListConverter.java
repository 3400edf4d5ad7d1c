package com.example.servicedesk.domain.json;

import com.example.servicedesk.domain.FilterCondition;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class FilterConditionListConverter extends JsonAttributeConverter<List<FilterCondition>> {

    public FilterConditionListConverter() {
        super(new TypeReference<List<FilterCondition>>() {});
    }

    @Override
    protected List<FilterCondition> empty() {
        return new ArrayList<>();
    }
}
