package com.wpanther.greengoods.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
    GARDENER("gardener"),
    OPERATOR("operator");

    private final String code;

    UserRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
