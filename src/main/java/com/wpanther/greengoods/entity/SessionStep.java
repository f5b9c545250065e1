package com.wpanther.greengoods.entity;

import com.wpanther.greengoods.dto.ai.ParsedWorkData;
import com.wpanther.greengoods.dto.SessionDraft;

/**
 * Position of a user in a multi-message conversation.
 * Each step declares the only draft shape it may carry; steps without a draft type carry none.
 */
public enum SessionStep {
    IDLE("idle", null),
    JOINING_GARDEN("joining_garden", null),
    SUBMITTING_WORK("submitting_work", null),
    CONFIRMING_WORK("confirming_work", ParsedWorkData.class),
    APPROVING_WORK("approving_work", null),
    REJECTING_WORK("rejecting_work", null),
    AWAITING_PHOTO("awaiting_photo", null),
    AWAITING_DETAILS("awaiting_details", null);

    private final String code;
    private final Class<? extends SessionDraft> draftType;

    SessionStep(String code, Class<? extends SessionDraft> draftType) {
        this.code = code;
        this.draftType = draftType;
    }

    public String getCode() {
        return code;
    }

    public Class<? extends SessionDraft> getDraftType() {
        return draftType;
    }

    /**
     * A missing draft is always acceptable (it reads as "empty"); a present draft must match the step.
     */
    public boolean accepts(SessionDraft draft) {
        if (draft == null) {
            return true;
        }
        return draftType != null && draftType.isInstance(draft);
    }
}
