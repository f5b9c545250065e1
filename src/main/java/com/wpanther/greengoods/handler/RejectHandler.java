package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.ledger.SubmitApprovalRequest;
import com.wpanther.greengoods.dto.ledger.VerificationResult;
import com.wpanther.greengoods.dto.message.CommandContent;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.port.LedgerPort;
import com.wpanther.greengoods.port.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * /reject &lt;workId&gt; [reason]: drops the work without attesting it.
 * Ledgers with approval attestations also get a negative approval before the record goes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RejectHandler {

    static final String DEFAULT_REASON = "No reason provided";

    private final StoragePort storage;
    private final LedgerPort ledgerPort;
    private final OperatorVerifier operatorVerifier;
    private final BestEffortNotifier notifier;
    private final PendingWorkLocks pendingWorkLocks;

    public HandlerResult handle(BotUser user, CommandContent command) {
        String workId = command.arg(0);
        if (workId == null || workId.isBlank()) {
            return HandlerResult.of(OutboundResponse.markdown(
                    "📍 *Usage:* `/reject <WorkID> [reason]`\n\n"
                            + "Example: `/reject abc123 Insufficient documentation`"));
        }
        String reason = reason(command.getArgs());

        Lock lock = pendingWorkLocks.lockFor(workId);
        lock.lock();
        try {
            return reject(user, workId, reason);
        } finally {
            lock.unlock();
        }
    }

    private HandlerResult reject(BotUser user, String workId, String reason) {
        Optional<PendingWork> found = storage.getPendingWork(workId);
        if (found.isEmpty()) {
            return HandlerResult.reply(ApproveHandler.NOT_FOUND);
        }
        PendingWork work = found.get();

        String gardenAddress = ApproveHandler.resolveGarden(work, user);
        if (gardenAddress == null) {
            return HandlerResult.reply(ApproveHandler.NO_GARDEN);
        }

        VerificationResult verification = operatorVerifier.verify(gardenAddress, user.getAddress());
        if (!verification.isVerified()) {
            return HandlerResult.of(ApproveHandler.permissionDenied(verification, "reject"));
        }

        if (ledgerPort.supportsApprovalAttestation()) {
            try {
                ledgerPort.submitApproval(SubmitApprovalRequest.builder()
                        .privateKey(user.getPrivateKey())
                        .gardenAddress(gardenAddress)
                        .gardenerAddress(work.getGardenerAddress())
                        .actionId(work.getActionId())
                        .approved(false)
                        .feedback(reason)
                        .build());
            } catch (Exception e) {
                log.error("Rejection attestation failed, work kept for retry: workId={}, garden={}",
                        workId, gardenAddress, e);
                return HandlerResult.reply("❌ Error rejecting: " + e.getMessage() + "\n\nPlease try again.");
            }
        }

        storage.removePendingWork(workId);
        log.info("Work rejected: workId={}, garden={}, operator={}", workId, gardenAddress, user.getAddress());

        notifier.send(work.getGardenerPlatform(), work.getGardenerPlatformId(),
                "❌ *Your work has been rejected*\n\n"
                        + "ID: `" + workId + "`\n"
                        + "Reason: " + reason + "\n\n"
                        + "Please try again with more details or photos.");

        return HandlerResult.reply("❌ Work " + workId + " rejected.\n\nReason: " + reason);
    }

    static String reason(List<String> args) {
        if (args == null || args.size() < 2) {
            return DEFAULT_REASON;
        }
        String joined = String.join(" ", args.subList(1, args.size())).trim();
        return joined.isEmpty() ? DEFAULT_REASON : joined;
    }
}
