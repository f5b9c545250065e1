package com.wpanther.greengoods.dto.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImageContent implements MessageContent {

    private String imageRef;

    private String mimeType;

    private String caption;

    @Override
    public ContentType kind() {
        return ContentType.IMAGE;
    }
}
