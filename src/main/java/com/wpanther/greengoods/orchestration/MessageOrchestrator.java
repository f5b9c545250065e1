package com.wpanther.greengoods.orchestration;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.message.CallbackContent;
import com.wpanther.greengoods.dto.message.CommandContent;
import com.wpanther.greengoods.dto.message.InboundMessage;
import com.wpanther.greengoods.dto.message.MessageContent;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.dto.message.TextContent;
import com.wpanther.greengoods.dto.message.VoiceContent;
import com.wpanther.greengoods.dto.ratelimit.ActionClass;
import com.wpanther.greengoods.dto.ratelimit.RateLimitResult;
import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.exception.CredentialVaultException;
import com.wpanther.greengoods.handler.ApproveHandler;
import com.wpanther.greengoods.handler.HelpHandler;
import com.wpanther.greengoods.handler.JoinHandler;
import com.wpanther.greengoods.handler.PendingHandler;
import com.wpanther.greengoods.handler.RejectHandler;
import com.wpanther.greengoods.handler.StartHandler;
import com.wpanther.greengoods.handler.StatusHandler;
import com.wpanther.greengoods.handler.SubmissionHandler;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.service.RateLimiterService;
import com.wpanther.greengoods.util.ReplyFormatUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Single entry point for inbound messages from every platform.
 * Resolves the user, applies rate limits, dispatches to a handler and persists the handler's
 * session change. Messages of one user are handled one at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageOrchestrator {

    static final String START_FIRST = "Please run /start first to create your wallet.";
    static final String JOIN_FIRST = "Please join a garden first with `/join <GardenAddress>`";
    static final String UNSUPPORTED = "❌ Unsupported message type.";
    static final String VAULT_FAILURE = "❌ Sorry, your wallet could not be accessed. Please try again later.";

    private final StoragePort storage;
    private final RateLimiterService rateLimiter;
    private final ConversationLocks conversationLocks;
    private final StartHandler startHandler;
    private final HelpHandler helpHandler;
    private final JoinHandler joinHandler;
    private final StatusHandler statusHandler;
    private final PendingHandler pendingHandler;
    private final SubmissionHandler submissionHandler;
    private final ApproveHandler approveHandler;
    private final RejectHandler rejectHandler;

    /**
     * Never throws: every failure becomes a reply.
     */
    public OutboundResponse handle(InboundMessage message) {
        if (message == null || message.getPlatform() == null || message.senderId() == null) {
            return OutboundResponse.text(UNSUPPORTED);
        }

        Lock lock = conversationLocks.lockFor(message.getPlatform(), message.senderId());
        lock.lock();
        try {
            return dispatch(message);
        } catch (CredentialVaultException e) {
            // vault messages may describe key material
            log.error("Credential vault failure: id={}, platform={}, platformId={}",
                    message.getId(), message.getPlatform().getCode(), message.senderId(), e);
            return OutboundResponse.text(VAULT_FAILURE);
        } catch (Exception e) {
            log.error("Message handling failed: id={}, platform={}, platformId={}",
                    message.getId(), message.getPlatform().getCode(), message.senderId(), e);
            return OutboundResponse.text("❌ Sorry, something went wrong. Please try again.\n\n"
                    + "Error: " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private OutboundResponse dispatch(InboundMessage message) {
        BotUser user = storage.getUser(message.getPlatform(), message.senderId()).orElse(null);
        MessageContent content = message.getContent();
        if (content == null) {
            return OutboundResponse.text(UNSUPPORTED);
        }

        switch (content.kind()) {
            case COMMAND:
                return handleCommand(message, user, (CommandContent) content);
            case TEXT:
                return handleText(message, user, (TextContent) content);
            case VOICE:
                return handleVoice(message, user, (VoiceContent) content);
            case CALLBACK:
                return handleCallback(message, user, (CallbackContent) content);
            default:
                log.debug("Unsupported content: type={}, platform={}", content.kind(), message.getPlatform().getCode());
                return OutboundResponse.text(UNSUPPORTED);
        }
    }

    private OutboundResponse handleCommand(InboundMessage message, BotUser user, CommandContent content) {
        BotCommand command = BotCommand.fromName(content.getName());
        if (command.requiresUser() && user == null) {
            return OutboundResponse.text(START_FIRST);
        }

        Optional<OutboundResponse> limited = consumeFor(message, command);
        if (limited.isPresent()) {
            return limited.get();
        }

        switch (command) {
            case START:
                return apply(message, startHandler.handle(message, user));
            case HELP:
                return apply(message, helpHandler.handle(user));
            case JOIN:
                return apply(message, joinHandler.handle(user, content));
            case STATUS:
                return apply(message, statusHandler.handle(user));
            case PENDING:
                return apply(message, pendingHandler.handle(user));
            case APPROVE:
                return apply(message, approveHandler.handle(user, content));
            case REJECT:
                return apply(message, rejectHandler.handle(user, content));
            case UNKNOWN:
            default:
                return OutboundResponse.text("Unknown command: /" + content.getName());
        }
    }

    private OutboundResponse handleText(InboundMessage message, BotUser user, TextContent content) {
        Optional<OutboundResponse> precondition = requireGardenMember(user);
        if (precondition.isPresent()) {
            return precondition.get();
        }
        Optional<OutboundResponse> limited = consume(message, ActionClass.MESSAGE);
        if (limited.isPresent()) {
            return limited.get();
        }
        return apply(message, submissionHandler.handleText(message, user, content.getText()));
    }

    private OutboundResponse handleVoice(InboundMessage message, BotUser user, VoiceContent content) {
        Optional<OutboundResponse> precondition = requireGardenMember(user);
        if (precondition.isPresent()) {
            return precondition.get();
        }
        Optional<OutboundResponse> limited = consume(message, ActionClass.VOICE);
        if (limited.isPresent()) {
            return limited.get();
        }
        return apply(message, submissionHandler.handleVoice(message, user, content));
    }

    private OutboundResponse handleCallback(InboundMessage message, BotUser user, CallbackContent content) {
        if (user == null) {
            return OutboundResponse.text("Session expired. Please start again with /start");
        }
        Optional<ConversationSession> session = storage.getSession(message.getPlatform(), message.senderId());

        switch (CallbackAction.fromData(content.getData())) {
            case CONFIRM_SUBMISSION: {
                if (session.isEmpty()) {
                    return OutboundResponse.text("Session expired. Please submit your work again.");
                }
                Optional<OutboundResponse> limited = consume(message, ActionClass.SUBMISSION);
                if (limited.isPresent()) {
                    return limited.get();
                }
                return apply(message, submissionHandler.confirm(message, user, session.get()));
            }
            case CANCEL_SUBMISSION:
                return apply(message, submissionHandler.cancel());
            case UNKNOWN:
            default:
                return OutboundResponse.text("Unknown action.");
        }
    }

    private Optional<OutboundResponse> requireGardenMember(BotUser user) {
        if (user == null) {
            return Optional.of(OutboundResponse.text(START_FIRST));
        }
        if (!user.hasGarden()) {
            return Optional.of(OutboundResponse.text(JOIN_FIRST));
        }
        return Optional.empty();
    }

    private Optional<OutboundResponse> consumeFor(InboundMessage message, BotCommand command) {
        switch (command) {
            case START:
                return consume(message, ActionClass.WALLET);
            case HELP:
                return Optional.empty();
            default:
                Optional<OutboundResponse> limited = consume(message, ActionClass.COMMAND);
                if (limited.isEmpty() && command.isApproval()) {
                    limited = consume(message, ActionClass.APPROVAL);
                }
                return limited;
        }
    }

    /**
     * Spends one token of the class; a denial comes back as the reply to send.
     */
    private Optional<OutboundResponse> consume(InboundMessage message, ActionClass actionClass) {
        String userId = ReplyFormatUtil.platformUserId(message.getPlatform().getCode(), message.senderId());
        RateLimitResult result = rateLimiter.check(userId, actionClass);
        if (result.isAllowed()) {
            return Optional.empty();
        }
        log.warn("Rate limited: user={}, class={}", userId, actionClass.getCode());
        return Optional.of(OutboundResponse.text("⏳ " + result.getMessage() + "\n\n"
                + "Please wait " + ReplyFormatUtil.formatWaitTime(result.getResetIn()) + " before trying again."));
    }

    private OutboundResponse apply(InboundMessage message, HandlerResult result) {
        if (result.isClearSession()) {
            storage.clearSession(message.getPlatform(), message.senderId());
        } else if (result.getSessionUpdate() != null) {
            storage.setSession(message.getPlatform(), message.senderId(), result.getSessionUpdate());
        }
        return result.getResponse();
    }
}
