package com.wpanther.greengoods.dto.message;

import com.wpanther.greengoods.entity.Platform;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Platform-agnostic message produced by a chat platform adapter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    @NotBlank(message = "Message id is required")
    private String id;

    @NotNull(message = "Platform is required")
    private Platform platform;

    @Valid
    @NotNull(message = "Sender is required")
    private Sender sender;

    @Valid
    @NotNull(message = "Content is required")
    private MessageContent content;

    private String locale;

    // Epoch milliseconds
    private long timestamp;

    public String senderId() {
        return sender != null ? sender.getPlatformId() : null;
    }
}
