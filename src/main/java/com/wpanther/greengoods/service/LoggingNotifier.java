package com.wpanther.greengoods.service;

import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.port.Notifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Notifier used when no platform adapter registers one; records the message instead of sending it.
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void notify(Platform platform, String platformId, String text) {
        log.info("Notification (not delivered, no adapter): platform={}, platformId={}, length={}",
                platform.getCode(), platformId, text == null ? 0 : text.length());
    }
}
