package com.wpanther.greengoods.orchestration;

import java.util.Locale;

/**
 * Closed set of text commands, resolved once from the command name.
 */
public enum BotCommand {
    START("start", false),
    HELP("help", false),
    JOIN("join", true),
    STATUS("status", true),
    PENDING("pending", true),
    APPROVE("approve", true),
    REJECT("reject", true),
    UNKNOWN(null, true);

    private final String commandName;
    private final boolean requiresUser;

    BotCommand(String commandName, boolean requiresUser) {
        this.commandName = commandName;
        this.requiresUser = requiresUser;
    }

    public String getCommandName() {
        return commandName;
    }

    public boolean requiresUser() {
        return requiresUser;
    }

    public boolean isApproval() {
        return this == APPROVE || this == REJECT;
    }

    /**
     * Case-insensitive; tolerates a leading slash and a Telegram style "@botname" suffix.
     */
    public static BotCommand fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        int mention = normalized.indexOf('@');
        if (mention >= 0) {
            normalized = normalized.substring(0, mention);
        }
        for (BotCommand command : values()) {
            if (normalized.equals(command.commandName)) {
                return command;
            }
        }
        return UNKNOWN;
    }
}
