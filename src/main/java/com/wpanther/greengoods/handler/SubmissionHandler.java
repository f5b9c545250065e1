package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.SessionUpdate;
import com.wpanther.greengoods.dto.WorkDraftData;
import com.wpanther.greengoods.dto.ai.ParsedTask;
import com.wpanther.greengoods.dto.ai.ParsedWorkData;
import com.wpanther.greengoods.dto.message.InboundMessage;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.dto.message.ParseMode;
import com.wpanther.greengoods.dto.message.ResponseButton;
import com.wpanther.greengoods.dto.message.VoiceContent;
import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.entity.SessionStep;
import com.wpanther.greengoods.orchestration.CallbackAction;
import com.wpanther.greengoods.port.AiPort;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.port.VoiceProcessor;
import com.wpanther.greengoods.service.CustodialWalletService;
import com.wpanther.greengoods.util.ReplyFormatUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Work submission flow: text or voice is parsed into a draft, the user confirms or cancels,
 * and a confirmed draft becomes a pending work item for the garden's operator.
 */
@Component
@Slf4j
public class SubmissionHandler {

    static final String NO_TASKS = "🤔 I couldn't identify any work tasks from your message.\n\n";
    private static final int MAX_ID_ATTEMPTS = 5;

    private final StoragePort storage;
    private final AiPort aiPort;
    private final Optional<VoiceProcessor> voiceProcessor;
    private final CustodialWalletService walletService;
    private final BestEffortNotifier notifier;
    private final Clock clock;

    public SubmissionHandler(StoragePort storage, AiPort aiPort, Optional<VoiceProcessor> voiceProcessor,
                             CustodialWalletService walletService, BestEffortNotifier notifier, Clock clock) {
        this.storage = storage;
        this.aiPort = aiPort;
        this.voiceProcessor = voiceProcessor;
        this.walletService = walletService;
        this.notifier = notifier;
        this.clock = clock;
    }

    public HandlerResult handleText(InboundMessage message, BotUser user, String text) {
        ParsedWorkData work;
        try {
            work = aiPort.parseWorkText(text, message.getLocale());
        } catch (Exception e) {
            log.error("Text processing failed: platform={}, platformId={}",
                    user.getPlatform().getCode(), user.getPlatformId(), e);
            return HandlerResult.reply("❌ Sorry, I couldn't process that message. Please try again.\n\n"
                    + "Error: " + e.getMessage());
        }

        if (work == null || !work.hasContent()) {
            return HandlerResult.reply(NO_TASKS
                    + "Try something like:\n"
                    + "• \"I planted 5 trees today\"\n"
                    + "• \"Removed 10kg of weeds\"\n"
                    + "• \"Planted 20 tomato seedlings\"");
        }
        return confirmation(work);
    }

    public HandlerResult handleVoice(InboundMessage message, BotUser user, VoiceContent voice) {
        if (voiceProcessor.isEmpty()) {
            return HandlerResult.reply("Voice processing is not available. Please send a text message instead.");
        }

        String transcript;
        ParsedWorkData work;
        try {
            transcript = voiceProcessor.get().downloadAndTranscribe(voice.getAudioRef(), voice.getMimeType());
            work = aiPort.parseWorkText(transcript, message.getLocale());
        } catch (Exception e) {
            log.error("Voice processing failed: platform={}, platformId={}, audioRef={}",
                    user.getPlatform().getCode(), user.getPlatformId(), voice.getAudioRef(), e);
            return HandlerResult.reply("❌ Sorry, I couldn't process that audio.\n\n"
                    + "Error: " + e.getMessage() + "\n\n"
                    + "Try sending a text message instead.");
        }

        if (work == null || !work.hasContent()) {
            return HandlerResult.reply("📝 I heard: \"" + transcript + "\"\n\n"
                    + NO_TASKS
                    + "Try saying something like:\n"
                    + "• \"I planted 5 trees today\"\n"
                    + "• \"Removed 10kg of weeds\"");
        }
        return confirmation(work);
    }

    /**
     * Turns the confirming_work draft into a pending work item. Always clears the session.
     */
    public HandlerResult confirm(InboundMessage message, BotUser user, ConversationSession session) {
        Optional<ParsedWorkData> draft = session == null
                ? Optional.empty()
                : session.draftAs(ParsedWorkData.class).filter(ParsedWorkData::hasContent);

        if (draft.isEmpty() || !user.hasGarden()) {
            return HandlerResult.clearing(OutboundResponse.text(
                    "Session expired or invalid. Please submit your work again."));
        }

        ParsedWorkData work = draft.get();
        String pendingId = newPendingId();
        PendingWork pending = PendingWork.builder()
                .id(pendingId)
                .actionId(0L)
                .gardenerAddress(user.getAddress())
                .gardenerPlatform(message.getPlatform())
                .gardenerPlatformId(message.senderId())
                .gardenAddress(user.getCurrentGarden())
                .data(toDraftData(work))
                .createdAt(Instant.now(clock))
                .build();
        storage.addPendingWork(pending);

        storage.getOperatorForGarden(user.getCurrentGarden()).ifPresent(operator ->
                notifier.send(operator.getPlatform(), operator.getPlatformId(),
                        "🔔 *New Work Submission*\n\n"
                                + "From: `" + ReplyFormatUtil.formatAddress(user.getAddress()) + "`\n"
                                + "ID: `" + pendingId + "`\n\n"
                                + work.getNotes() + "\n\n"
                                + "Reply with `/approve " + pendingId + "` to approve."));

        return HandlerResult.clearing(OutboundResponse.markdown(
                "✅ *Work submitted for approval!*\n\n"
                        + "ID: `" + pendingId + "`\n\n"
                        + "An operator will review your submission soon."));
    }

    public HandlerResult cancel() {
        return HandlerResult.clearing(OutboundResponse.text("❌ Submission cancelled."));
    }

    private HandlerResult confirmation(ParsedWorkData work) {
        String tasks = work.getTasks().stream()
                .map(task -> "• " + task.summary())
                .collect(Collectors.joining("\n"));

        OutboundResponse response = OutboundResponse.builder()
                .text("📋 *Confirm your submission:*\n\n"
                        + "*Tasks:*\n" + tasks + "\n\n"
                        + "*Notes:* " + work.getNotes() + "\n"
                        + "*Date:* " + work.getDate())
                .parseMode(ParseMode.MARKDOWN)
                .buttons(List.of(
                        ResponseButton.callback("✅ Submit", CallbackAction.CONFIRM_SUBMISSION.getData()),
                        ResponseButton.callback("❌ Cancel", CallbackAction.CANCEL_SUBMISSION.getData())))
                .build();

        return HandlerResult.builder()
                .response(response)
                .sessionUpdate(SessionUpdate.of(SessionStep.CONFIRMING_WORK, work))
                .build();
    }

    static WorkDraftData toDraftData(ParsedWorkData work) {
        List<String> species = work.getTasks().stream()
                .map(ParsedTask::getSpecies)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
        // saturates instead of wrapping
        long plantCount = work.getTasks().stream()
                .mapToLong(ParsedTask::quantity)
                .sum();

        return WorkDraftData.builder()
                .actionId(0L)
                .title("Submission")
                .plantSelection(species)
                .plantCount((int) Math.min(Integer.MAX_VALUE, plantCount))
                .feedback(work.getNotes())
                .media(new ArrayList<>())
                .build();
    }

    private String newPendingId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String id = walletService.generateSecureId();
            if (!storage.pendingWorkExists(id)) {
                return id;
            }
            log.warn("Pending work id collision, regenerating: id={}", id);
        }
        throw new IllegalStateException("Could not generate a unique pending work id");
    }
}
