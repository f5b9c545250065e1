package com.wpanther.greengoods.handler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped per-work-id locks; approve and reject hold one from lookup until the record is removed,
 * so a pending work is attested or rejected at most once.
 * Always taken inside the per-user conversation lock, never the other way round.
 */
@Component
public class PendingWorkLocks {

    private final ReentrantLock[] stripes;

    public PendingWorkLocks(@Value("${app.pending.lock-stripes:64}") int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("app.pending.lock-stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Lock lockFor(String workId) {
        return stripes[Math.floorMod(workId.hashCode(), stripes.length)];
    }
}
