package com.wpanther.greengoods.service;

import com.wpanther.greengoods.config.RateLimitProperties;
import com.wpanther.greengoods.dto.ratelimit.ActionClass;
import com.wpanther.greengoods.dto.ratelimit.RateLimitOverride;
import com.wpanther.greengoods.dto.ratelimit.RateLimitResult;
import com.wpanther.greengoods.dto.ratelimit.RateLimitStatus;
import com.wpanther.greengoods.dto.ratelimit.RateLimiterStats;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sliding-window rate limiter keyed by (user, action class).
 * Every bucket mutation runs inside {@link ConcurrentHashMap#compute}, which serializes access per key;
 * buckets that become empty are removed.
 * Process local: several instances do not share counters.
 */
@Service
@Slf4j
public class RateLimiterService {

    private final Map<BucketKey, Deque<Long>> buckets = new ConcurrentHashMap<>();
    private final Map<ActionClass, RateLimitOverride> limits = new EnumMap<>(ActionClass.class);
    private final Clock clock;

    public RateLimiterService(RateLimitProperties properties, Clock clock) {
        this.clock = clock;
        for (ActionClass actionClass : ActionClass.values()) {
            RateLimitOverride limit = properties.resolve(actionClass);
            if (limit.getMaxRequests() < 0 || limit.getWindowMs() <= 0) {
                throw new IllegalStateException("Invalid rate limit for " + actionClass.getCode());
            }
            limits.put(actionClass, limit);
        }
        log.info("Rate limits configured: {}", limits);
    }

    public RateLimitResult check(String userId, ActionClass actionClass) {
        return check(userId, actionClass, null);
    }

    /**
     * Consumes one slot when allowed; a denied call leaves the bucket unchanged.
     */
    public RateLimitResult check(String userId, ActionClass actionClass, RateLimitOverride override) {
        RateLimitOverride limit = RateLimitProperties.merge(limits.get(actionClass), override);
        int maxRequests = limit.getMaxRequests();
        long windowMs = limit.getWindowMs();
        long now = clock.millis();
        AtomicReference<RateLimitResult> result = new AtomicReference<>();

        buckets.compute(new BucketKey(userId, actionClass), (key, timestamps) -> {
            Deque<Long> window = timestamps != null ? timestamps : new ArrayDeque<>();
            prune(window, now, windowMs);

            boolean allowed = window.size() < maxRequests;
            if (allowed) {
                window.addLast(now);
            }
            result.set(RateLimitResult.builder()
                    .allowed(allowed)
                    .remaining(Math.max(0, maxRequests - window.size()))
                    .resetIn(resetIn(window, now, windowMs))
                    .limit(maxRequests)
                    .message(allowed ? null : limit.getMessage())
                    .build());
            return window.isEmpty() ? null : window;
        });

        RateLimitResult outcome = result.get();
        if (!outcome.isAllowed()) {
            log.debug("Rate limit hit: user={}, class={}, resetIn={}ms",
                    userId, actionClass.getCode(), outcome.getResetIn());
        }
        return outcome;
    }

    /**
     * Remaining allowance without consuming a slot or pruning the bucket.
     */
    public RateLimitStatus peek(String userId, ActionClass actionClass) {
        RateLimitOverride limit = limits.get(actionClass);
        long windowStart = clock.millis() - limit.getWindowMs();
        AtomicInteger inWindow = new AtomicInteger();

        buckets.computeIfPresent(new BucketKey(userId, actionClass), (key, timestamps) -> {
            for (Long timestamp : timestamps) {
                if (timestamp > windowStart) {
                    inWindow.incrementAndGet();
                }
            }
            return timestamps;
        });

        return new RateLimitStatus(Math.max(0, limit.getMaxRequests() - inWindow.get()), limit.getMaxRequests());
    }

    public void reset(String userId, ActionClass actionClass) {
        buckets.remove(new BucketKey(userId, actionClass));
    }

    public void resetAll(String userId) {
        buckets.keySet().removeIf(key -> key.getUserId().equals(userId));
    }

    /**
     * Prunes every bucket against its configured window and drops the empty ones.
     *
     * @return number of buckets removed
     */
    public int cleanup() {
        long now = clock.millis();
        AtomicInteger removed = new AtomicInteger();
        for (BucketKey key : buckets.keySet()) {
            long windowMs = limits.get(key.getActionClass()).getWindowMs();
            buckets.computeIfPresent(key, (k, timestamps) -> {
                prune(timestamps, now, windowMs);
                if (timestamps.isEmpty()) {
                    removed.incrementAndGet();
                    return null;
                }
                return timestamps;
            });
        }
        return removed.get();
    }

    public RateLimiterStats getStats() {
        AtomicInteger trackedBuckets = new AtomicInteger();
        AtomicLong totalTimestamps = new AtomicLong();
        for (BucketKey key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, timestamps) -> {
                trackedBuckets.incrementAndGet();
                totalTimestamps.addAndGet(timestamps.size());
                return timestamps;
            });
        }
        return new RateLimiterStats(trackedBuckets.get(), totalTimestamps.get());
    }

    public RateLimitOverride getLimit(ActionClass actionClass) {
        return limits.get(actionClass);
    }

    private static void prune(Deque<Long> timestamps, long now, long windowMs) {
        long windowStart = now - windowMs;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= windowStart) {
            timestamps.pollFirst();
        }
    }

    private static long resetIn(Deque<Long> timestamps, long now, long windowMs) {
        Long oldest = timestamps.peekFirst();
        if (oldest == null) {
            return windowMs;
        }
        return Math.max(0, windowMs - (now - oldest));
    }

    @Value
    private static class BucketKey {
        String userId;
        ActionClass actionClass;
    }
}
