package com.wpanther.greengoods.dto.ratelimit;

/**
 * Independently limited kinds of user activity.
 */
public enum ActionClass {
    MESSAGE("message"),
    COMMAND("command"),
    SUBMISSION("submission"),
    VOICE("voice"),
    APPROVAL("approval"),
    WALLET("wallet");

    private final String code;

    ActionClass(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
