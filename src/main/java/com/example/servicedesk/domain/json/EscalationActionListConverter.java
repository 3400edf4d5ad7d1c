package com.example.servicedesk.domain.json;

import com.example.servicedesk.domain.EscalationAction;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class EscalationActionListConverter extends JsonAttributeConverter<List<EscalationAction>> {

    public EscalationActionListConverter() {
        super(new TypeReference<List<EscalationAction>>() {});
    }

    @Override
    protected List<EscalationAction> empty() {
        return new ArrayList<>();
    }
}
