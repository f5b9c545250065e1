package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import org.springframework.stereotype.Component;

@Component
public class HelpHandler {

    public HandlerResult handle(BotUser user) {
        StringBuilder help = new StringBuilder()
                .append("🌿 *Green Goods Bot Help*\n\n")
                .append("*Basic Commands:*\n")
                .append("/start - Create wallet & get started\n")
                .append("/join <address> - Join a garden\n")
                .append("/status - Check your current status\n\n")
                .append("*Submitting Work:*\n")
                .append("Simply send a text or voice message describing your work!\n")
                .append("Example: \"I planted 5 trees today\"\n\n");

        if (user != null && user.isOperator()) {
            help.append("*Operator Commands:*\n")
                    .append("/approve <id> - Approve a work submission\n")
                    .append("/reject <id> [reason] - Reject a work submission\n")
                    .append("/pending - List pending work for your garden\n\n");
        }

        help.append("_Need help? Contact @GreenGoodsSupport_");
        return HandlerResult.of(OutboundResponse.markdown(help.toString()));
    }
}
