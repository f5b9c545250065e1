package com.wpanther.greengoods.util;

/**
 * Text helpers shared by the reply builders.
 */
public final class ReplyFormatUtil {

    private ReplyFormatUtil() {
    }

    /**
     * Human readable wait: whole seconds under a minute, otherwise whole minutes, always rounded up.
     */
    public static String formatWaitTime(long millis) {
        long seconds = (long) Math.ceil(Math.max(0, millis) / 1000.0);
        if (seconds < 60) {
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        long minutes = (long) Math.ceil(seconds / 60.0);
        return minutes + (minutes == 1 ? " minute" : " minutes");
    }

    /**
     * Shortens 0x1234567890abcdef... to 0x1234...cdef.
     */
    public static String formatAddress(String address) {
        if (address == null || address.length() < 10) {
            return address;
        }
        return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
    }

    public static String platformUserId(String platformCode, String platformId) {
        return platformCode + ":" + platformId;
    }
}
