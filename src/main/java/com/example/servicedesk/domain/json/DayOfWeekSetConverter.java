package com.example.servicedesk.domain.json;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

@Converter
public class DayOfWeekSetConverter extends JsonAttributeConverter<Set<DayOfWeek>> {

    public DayOfWeekSetConverter() {
        super(new TypeReference<Set<DayOfWeek>>() {});
    }

    @Override
    protected Set<DayOfWeek> empty() {
        return EnumSet.noneOf(DayOfWeek.class);
    }
}
