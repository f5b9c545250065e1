package com.wpanther.greengoods.orchestration;

import com.wpanther.greengoods.entity.Platform;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped per-user locks so that one user's messages are handled one at a time.
 * Two users may share a stripe; that only costs them some parallelism.
 */
@Component
public class ConversationLocks {

    private final ReentrantLock[] stripes;

    public ConversationLocks(@Value("${app.conversation.lock-stripes:64}") int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("app.conversation.lock-stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Lock lockFor(Platform platform, String platformId) {
        int hash = 31 * platform.ordinal() + (platformId == null ? 0 : platformId.hashCode());
        return stripes[Math.floorMod(hash, stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
