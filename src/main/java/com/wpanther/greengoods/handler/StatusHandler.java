package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.dto.ratelimit.ActionClass;
import com.wpanther.greengoods.dto.ratelimit.RateLimitStatus;
import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.entity.SessionStep;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.service.RateLimiterService;
import com.wpanther.greengoods.util.ReplyFormatUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StatusHandler {

    private final StoragePort storage;
    private final RateLimiterService rateLimiter;

    public HandlerResult handle(BotUser user) {
        SessionStep step = storage.getSession(user.getPlatform(), user.getPlatformId())
                .map(ConversationSession::getStep)
                .orElse(SessionStep.IDLE);
        // peek, so asking for status does not spend a submission
        RateLimitStatus submissions = rateLimiter.peek(
                ReplyFormatUtil.platformUserId(user.getPlatform().getCode(), user.getPlatformId()),
                ActionClass.SUBMISSION);

        return HandlerResult.of(OutboundResponse.markdown(
                "📊 *Your Status*\n\n"
                        + "*Wallet:* `" + user.getAddress() + "`\n"
                        + "*Role:* " + (user.getRole() != null ? user.getRole().getCode() : "gardener") + "\n"
                        + "*Garden:* " + StartHandler.gardenLabel(user) + "\n"
                        + "*Session:* " + step.getCode() + "\n"
                        + "*Submissions remaining:* " + submissions.getRemaining() + "/" + submissions.getLimit()));
    }
}
