package com.example.servicedesk.domain.json;

import com.example.servicedesk.domain.ChannelPreference;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class ChannelPreferenceMapConverter extends JsonAttributeConverter<Map<String, ChannelPreference>> {

    public ChannelPreferenceMapConverter() {
        super(new TypeReference<LinkedHashMap<String, ChannelPreference>>() {});
    }

    @Override
    protected Map<String, ChannelPreference> empty() {
        return new LinkedHashMap<>();
    }
}
