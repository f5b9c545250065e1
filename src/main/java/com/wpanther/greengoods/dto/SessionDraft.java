package com.wpanther.greengoods.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.wpanther.greengoods.dto.ai.ParsedWorkData;

/**
 * Payload a conversation step carries between messages.
 * Persisted as JSON; the "kind" property selects the concrete type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ParsedWorkData.class, name = "parsed_work")
})
public interface SessionDraft {

    /**
     * @return false when the draft holds nothing a handler could act on
     */
    boolean hasContent();
}
