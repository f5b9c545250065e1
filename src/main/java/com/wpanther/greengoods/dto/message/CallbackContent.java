package com.wpanther.greengoods.dto.message;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A button press; data is the callbackData of the pressed button.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallbackContent implements MessageContent {

    @NotBlank(message = "Callback data is required")
    private String data;

    private String messageId;

    @Override
    public ContentType kind() {
        return ContentType.CALLBACK;
    }
}
