package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.ledger.SubmitApprovalRequest;
import com.wpanther.greengoods.dto.ledger.SubmitWorkRequest;
import com.wpanther.greengoods.dto.ledger.VerificationResult;
import com.wpanther.greengoods.dto.message.CommandContent;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.port.LedgerPort;
import com.wpanther.greengoods.port.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * /approve &lt;workId&gt;: attests the work on the ledger, then removes it from the queue.
 * The record is only removed after every ledger call succeeded, so a failure leaves it for a retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApproveHandler {

    static final String NOT_FOUND = "❌ Work not found or already processed.";
    static final String NO_GARDEN = "❌ Cannot determine garden for this work.";

    private final StoragePort storage;
    private final LedgerPort ledgerPort;
    private final OperatorVerifier operatorVerifier;
    private final BestEffortNotifier notifier;
    private final PendingWorkLocks pendingWorkLocks;

    public HandlerResult handle(BotUser user, CommandContent command) {
        String workId = command.arg(0);
        if (workId == null || workId.isBlank()) {
            return HandlerResult.of(OutboundResponse.markdown(
                    "📍 *Usage:* `/approve <WorkID>`\n\nExample: `/approve abc123`"));
        }

        Lock lock = pendingWorkLocks.lockFor(workId);
        lock.lock();
        try {
            return approve(user, workId);
        } finally {
            lock.unlock();
        }
    }

    private HandlerResult approve(BotUser user, String workId) {
        Optional<PendingWork> found = storage.getPendingWork(workId);
        if (found.isEmpty()) {
            return HandlerResult.reply(NOT_FOUND);
        }
        PendingWork work = found.get();

        String gardenAddress = resolveGarden(work, user);
        if (gardenAddress == null) {
            return HandlerResult.reply(NO_GARDEN);
        }

        VerificationResult verification = operatorVerifier.verify(gardenAddress, user.getAddress());
        if (!verification.isVerified()) {
            return HandlerResult.of(permissionDenied(verification, "approve"));
        }

        String tx;
        try {
            tx = ledgerPort.submitWork(SubmitWorkRequest.builder()
                    .privateKey(user.getPrivateKey())
                    .gardenAddress(gardenAddress)
                    .gardenerAddress(work.getGardenerAddress())
                    .data(work.getData())
                    .build());

            if (ledgerPort.supportsApprovalAttestation()) {
                ledgerPort.submitApproval(SubmitApprovalRequest.builder()
                        .privateKey(user.getPrivateKey())
                        .gardenAddress(gardenAddress)
                        .workReference(tx)
                        .gardenerAddress(work.getGardenerAddress())
                        .actionId(work.getActionId())
                        .approved(true)
                        .feedback(work.getData().getFeedback())
                        .build());
            }
        } catch (Exception e) {
            log.error("Approval failed, work kept for retry: workId={}, garden={}, operator={}",
                    workId, gardenAddress, user.getAddress(), e);
            return HandlerResult.reply("❌ Error approving: " + e.getMessage() + "\n\n"
                    + "The work is still pending. If the ledger already shows this attestation, "
                    + "do not approve it again.");
        }

        if (!storage.removePendingWork(workId)) {
            log.warn("Pending work already removed after attestation: workId={}, tx={}", workId, tx);
        }
        log.info("Work approved: workId={}, garden={}, operator={}, tx={}",
                workId, gardenAddress, user.getAddress(), tx);

        notifier.send(work.getGardenerPlatform(), work.getGardenerPlatformId(),
                "🎉 *Your work has been approved!*\n\n"
                        + "ID: `" + workId + "`\n"
                        + "Tx: `" + tx + "`");

        return HandlerResult.of(OutboundResponse.markdown(
                "✅ *Work approved and attested!*\n\nTx: `" + tx + "`"));
    }

    static String resolveGarden(PendingWork work, BotUser user) {
        if (work.getGardenAddress() != null && !work.getGardenAddress().isEmpty()) {
            return work.getGardenAddress();
        }
        return user.hasGarden() ? user.getCurrentGarden() : null;
    }

    static OutboundResponse permissionDenied(VerificationResult verification, String verb) {
        return OutboundResponse.markdown("❌ *Permission Denied*\n\n" + verification.getReason() + "\n\n"
                + "Only registered operators can " + verb + " work for this garden.");
    }
}
