package com.wpanther.greengoods.handler;

import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.port.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sends follow-up notifications whose failure must not undo the action that triggered them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BestEffortNotifier {

    private final Notifier notifier;

    /**
     * @return whether the notifier accepted the message
     */
    public boolean send(Platform platform, String platformId, String text) {
        try {
            notifier.notify(platform, platformId, text);
            return true;
        } catch (Exception e) {
            log.error("Notification failed: platform={}, platformId={}", platform.getCode(), platformId, e);
            return false;
        }
    }
}
