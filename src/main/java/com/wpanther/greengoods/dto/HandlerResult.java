package com.wpanther.greengoods.dto;

import com.wpanther.greengoods.dto.message.OutboundResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a handler returns: the reply plus an optional session mutation.
 * The orchestrator applies the mutation; when both are set, clearing wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandlerResult {

    private OutboundResponse response;

    private SessionUpdate sessionUpdate;

    private boolean clearSession;

    public static HandlerResult of(OutboundResponse response) {
        return HandlerResult.builder().response(response).build();
    }

    public static HandlerResult reply(String text) {
        return of(OutboundResponse.text(text));
    }

    public static HandlerResult clearing(OutboundResponse response) {
        return HandlerResult.builder().response(response).clearSession(true).build();
    }
}
