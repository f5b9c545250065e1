package com.wpanther.greengoods.dto.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Platform-agnostic reply; the adapter renders it natively.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OutboundResponse {

    private String text;

    private ParseMode parseMode;

    private List<ResponseButton> buttons;

    private List<ResponseAttachment> attachments;

    public static OutboundResponse text(String text) {
        return OutboundResponse.builder().text(text).build();
    }

    public static OutboundResponse markdown(String text) {
        return OutboundResponse.builder().text(text).parseMode(ParseMode.MARKDOWN).build();
    }
}
