package com.wpanther.greengoods.port;

import com.wpanther.greengoods.entity.Platform;

/**
 * Pushes an unsolicited text message to a user on their platform.
 */
public interface Notifier {

    void notify(Platform platform, String platformId, String text);
}
