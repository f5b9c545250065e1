package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.HandlerResult;
import com.wpanther.greengoods.dto.UserUpdate;
import com.wpanther.greengoods.dto.ledger.GardenInfo;
import com.wpanther.greengoods.dto.message.CommandContent;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.port.LedgerPort;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.service.CustodialWalletService;
import com.wpanther.greengoods.util.ReplyFormatUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * /join &lt;gardenAddress&gt;: validates the address and that the ledger knows the garden.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JoinHandler {

    private final StoragePort storage;
    private final LedgerPort ledgerPort;
    private final CustodialWalletService walletService;

    public HandlerResult handle(BotUser user, CommandContent command) {
        String gardenAddress = command.arg(0);
        if (gardenAddress == null || gardenAddress.isBlank()) {
            return HandlerResult.of(OutboundResponse.markdown(
                    "📍 *Usage:* `/join <GardenAddress>`\n\nExample: `/join 0x1234...abcd`"));
        }
        gardenAddress = gardenAddress.trim();
        if (!walletService.isValidAddress(gardenAddress)) {
            return HandlerResult.reply("❌ Invalid address format.\n\n"
                    + "Please provide a valid Ethereum address (0x followed by 40 hex characters).");
        }
        // One canonical spelling, so gardeners and operators of a garden match
        String canonical = walletService.toChecksumAddress(gardenAddress);

        GardenInfo garden;
        try {
            garden = ledgerPort.getGardenInfo(canonical);
        } catch (Exception e) {
            log.error("Garden lookup failed: garden={}, user={}", canonical, user.getAddress(), e);
            return HandlerResult.reply("❌ Sorry, I couldn't verify that garden right now. Please try again.\n\n"
                    + "Error: " + e.getMessage());
        }

        if (garden == null || !garden.isExists()) {
            return HandlerResult.of(OutboundResponse.markdown(
                    "❌ *Garden not found*\n\n"
                            + "This address doesn't appear to be a valid Green Goods garden contract.\n\n"
                            + "Please verify the address and try again."));
        }

        storage.updateUser(user.getPlatform(), user.getPlatformId(),
                UserUpdate.builder().currentGarden(canonical).build());
        log.info("User joined garden: platform={}, platformId={}, garden={}",
                user.getPlatform().getCode(), user.getPlatformId(), canonical);

        return HandlerResult.of(OutboundResponse.markdown(
                "✅ *Joined garden successfully!*\n\n"
                        + "Garden: " + (garden.getName() != null ? "*" + garden.getName() + "*" : "") + "\n"
                        + "Address: `" + ReplyFormatUtil.formatAddress(canonical) + "`\n\n"
                        + "You can now submit work by sending me a text or voice message."));
    }
}
