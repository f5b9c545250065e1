package com.wpanther.greengoods.orchestration;

public enum CallbackAction {
    CONFIRM_SUBMISSION("confirm_submission"),
    CANCEL_SUBMISSION("cancel_submission"),
    UNKNOWN(null);

    private final String data;

    CallbackAction(String data) {
        this.data = data;
    }

    /**
     * Callback payload carried by the button that triggers this action.
     */
    public String getData() {
        return data;
    }

    public static CallbackAction fromData(String data) {
        for (CallbackAction action : values()) {
            if (action.data != null && action.data.equals(data)) {
                return action;
            }
        }
        return UNKNOWN;
    }
}
