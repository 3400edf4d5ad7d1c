package com.example.servicedesk.domain.json;

import com.example.servicedesk.domain.NotificationEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class NotificationEventListConverter extends JsonAttributeConverter<List<NotificationEvent>> {

    public NotificationEventListConverter() {
        super(new TypeReference<List<NotificationEvent>>() {});
    }

    @Override
    protected List<NotificationEvent> empty() {
        return new ArrayList<>();
    }
}
