package com.wpanther.greengoods.dto.message;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextContent implements MessageContent {

    @NotNull(message = "Text is required")
    private String text;

    @Override
    public ContentType kind() {
        return ContentType.TEXT;
    }
}
