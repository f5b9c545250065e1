package com.wpanther.greengoods.dto.message;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoiceContent implements MessageContent {

    // Platform file id or URL the voice processor can fetch
    @NotBlank(message = "Audio reference is required")
    private String audioRef;

    private String mimeType;

    // Seconds, when the platform reports it
    private Integer duration;

    @Override
    public ContentType kind() {
        return ContentType.VOICE;
    }
}
