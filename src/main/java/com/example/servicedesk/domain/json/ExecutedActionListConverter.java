package com.example.servicedesk.domain.json;

import com.example.servicedesk.domain.ExecutedAction;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ExecutedActionListConverter extends JsonAttributeConverter<List<ExecutedAction>> {

    public ExecutedActionListConverter() {
        super(new TypeReference<List<ExecutedAction>>() {});
    }

    @Override
    protected List<ExecutedAction> empty() {
        return new ArrayList<>();
    }
}
