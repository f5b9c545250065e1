package com.wpanther.greengoods.dto;

import com.wpanther.greengoods.entity.SessionStep;
import lombok.Getter;
import lombok.ToString;

/**
 * New step and draft a handler wants persisted. The (step, draft) pair is checked on construction.
 */
@Getter
@ToString
public final class SessionUpdate {

    private final SessionStep step;
    private final SessionDraft draft;

    private SessionUpdate(SessionStep step, SessionDraft draft) {
        this.step = step;
        this.draft = draft;
    }

    public static SessionUpdate of(SessionStep step, SessionDraft draft) {
        SessionStep target = step != null ? step : SessionStep.IDLE;
        if (!target.accepts(draft)) {
            throw new IllegalArgumentException("Step " + target.getCode() + " cannot carry draft "
                    + draft.getClass().getSimpleName());
        }
        return new SessionUpdate(target, draft);
    }
}
