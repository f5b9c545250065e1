package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.WorkDraftData;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.util.ReplyFormatUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /pending: operator view of the approval queue of their garden, newest first.
 */
@Component
@RequiredArgsConstructor
public class PendingHandler {

    private final StoragePort storage;

    @Value("${app.pending.page-size:10}")
    private int pageSize = 10;

    public HandlerResult handle(BotUser user) {
        if (!user.isOperator()) {
            return HandlerResult.reply("This command is only available for operators.");
        }
        if (!user.hasGarden()) {
            return HandlerResult.reply("Please join a garden first with `/join <GardenAddress>`");
        }

        List<PendingWork> works = storage.getPendingWorksForGarden(user.getCurrentGarden());
        if (works.isEmpty()) {
            return HandlerResult.reply("No pending work submissions for your garden.");
        }

        StringBuilder reply = new StringBuilder("📋 *Pending Work Submissions*\n\n");
        for (PendingWork work : works.subList(0, Math.min(pageSize, works.size()))) {
            WorkDraftData data = work.getData();
            reply.append("*ID:* `").append(work.getId()).append("`\n")
                    .append("Gardener: `").append(ReplyFormatUtil.formatAddress(work.getGardenerAddress())).append("`\n")
                    .append("Title: ").append(data.getTitle()).append("\n")
                    .append("Plants: ").append(data.getPlantCount())
                    .append(" (").append(String.join(", ", data.getPlantSelection())).append(")\n\n");
        }
        if (works.size() > pageSize) {
            reply.append("_...and ").append(works.size() - pageSize).append(" more_\n\n");
        }
        reply.append("Use `/approve <id>` or `/reject <id>` to process.");

        return HandlerResult.of(OutboundResponse.markdown(reply.toString()));
    }
}
