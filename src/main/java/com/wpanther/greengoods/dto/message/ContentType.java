package com.wpanther.greengoods.dto.message;

public enum ContentType {
    TEXT,
    COMMAND,
    VOICE,
    CALLBACK,
    IMAGE
}
