package com.wpanther.greengoods.dto.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload of an inbound message. The JSON "type" property selects the concrete content.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextContent.class, name = "text"),
    @JsonSubTypes.Type(value = CommandContent.class, name = "command"),
    @JsonSubTypes.Type(value = VoiceContent.class, name = "voice"),
    @JsonSubTypes.Type(value = CallbackContent.class, name = "callback"),
    @JsonSubTypes.Type(value = ImageContent.class, name = "image")
})
public interface MessageContent {

    ContentType kind();
}
