package com.wpanther.greengoods.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.greengoods.dto.WorkDraftData;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class WorkDraftDataConverter implements AttributeConverter<WorkDraftData, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(WorkDraftData data) {
        if (data == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize work data: " + e.getMessage(), e);
        }
    }

    @Override
    public WorkDraftData convertToEntityAttribute(String json) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(json, WorkDraftData.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored work data is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
