package com.wpanther.greengoods.dto.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseAttachment {

    private AttachmentType type;

    private String url;

    private String caption;

    public enum AttachmentType {
        IMAGE,
        FILE
    }
}
