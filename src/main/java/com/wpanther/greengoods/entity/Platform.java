package com.wpanther.greengoods.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Chat platforms a message can originate from.
 */
public enum Platform {
    TELEGRAM("telegram"),
    DISCORD("discord"),
    WHATSAPP("whatsapp"),
    SMS("sms");

    private final String code;

    Platform(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Platform fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (Platform platform : values()) {
            if (platform.code.equalsIgnoreCase(code)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unsupported platform: " + code);
    }
}
