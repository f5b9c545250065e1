package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.CreateUserRequest;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.message.InboundMessage;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.service.CustodialWalletService;
import com.wpanther.greengoods.util.ReplyFormatUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * /start: creates the custodial wallet on first use, greets returning users otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StartHandler {

    private final StoragePort storage;
    private final CustodialWalletService walletService;

    public HandlerResult handle(InboundMessage message, BotUser existing) {
        if (existing != null) {
            return HandlerResult.of(OutboundResponse.markdown(
                    "🌿 *Welcome back!*\n\n"
                            + "Wallet: `" + ReplyFormatUtil.formatAddress(existing.getAddress()) + "`\n"
                            + "Garden: " + gardenLabel(existing) + "\n\n"
                            + "_Send me a message to submit work or use /help for commands._"));
        }

        BotUser created;
        try {
            String privateKey = walletService.generatePrivateKey();
            created = storage.createUser(CreateUserRequest.builder()
                    .platform(message.getPlatform())
                    .platformId(message.senderId())
                    .privateKey(privateKey)
                    .address(walletService.deriveAddress(privateKey))
                    .build());
        } catch (Exception e) {
            log.error("Wallet creation failed: platform={}, platformId={}",
                    message.getPlatform().getCode(), message.senderId(), e);
            return HandlerResult.reply("❌ Sorry, I couldn't create your wallet. Please try again.\n\n"
                    + "Error: " + e.getMessage());
        }

        return HandlerResult.of(OutboundResponse.markdown(
                "🌿 *Welcome to Green Goods!*\n\n"
                        + "I've created a wallet for you:\n"
                        + "`" + created.getAddress() + "`\n\n"
                        + "*Commands:*\n"
                        + "/join <address> - Join a garden\n"
                        + "/status - Check your current status\n"
                        + "/help - Show all commands\n\n"
                        + "_Send me a text or voice message to submit work!_"));
    }

    static String gardenLabel(BotUser user) {
        return user.hasGarden() ? "`" + ReplyFormatUtil.formatAddress(user.getCurrentGarden()) + "`" : "_Not joined_";
    }
}
