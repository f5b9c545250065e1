package com.wpanther.greengoods.dto.message;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParseMode {
    MARKDOWN,
    HTML;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
