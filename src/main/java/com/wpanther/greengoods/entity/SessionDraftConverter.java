package com.wpanther.greengoods.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.greengoods.dto.SessionDraft;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores session drafts as JSON. An unreadable draft loads as null so the session reads as empty.
 */
@Converter
@Slf4j
public class SessionDraftConverter implements AttributeConverter<SessionDraft, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(SessionDraft draft) {
        if (draft == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(draft);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session draft: " + e.getMessage(), e);
        }
    }

    @Override
    public SessionDraft convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, SessionDraft.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable session draft: {}", e.getOriginalMessage());
            return null;
        }
    }
}
