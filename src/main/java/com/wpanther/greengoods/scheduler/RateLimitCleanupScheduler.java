package com.wpanther.greengoods.scheduler;

import com.wpanther.greengoods.dto.ratelimit.RateLimiterStats;
import com.wpanther.greengoods.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops rate-limit buckets of users who went quiet, so memory stays bounded
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class RateLimitCleanupScheduler {

    private final RateLimiterService rateLimiterService;

    /**
     * Runs every minute by default (configurable via app.rate-limit.cleanup-interval-ms)
     */
    @Scheduled(fixedDelayString = "${app.rate-limit.cleanup-interval-ms:60000}",
            initialDelayString = "${app.rate-limit.cleanup-interval-ms:60000}")
    public void cleanupIdleBuckets() {
        try {
            int removed = rateLimiterService.cleanup();
            RateLimiterStats stats = rateLimiterService.getStats();

            if (removed > 0) {
                log.info("Rate limiter cleanup: {} idle buckets removed, {} buckets tracking {} requests",
                        removed, stats.getTrackedBuckets(), stats.getTotalTimestamps());
            } else {
                log.debug("Rate limiter cleanup: nothing to remove, {} buckets tracked", stats.getTrackedBuckets());
            }
        } catch (Exception e) {
            log.error("Error during rate limiter cleanup", e);
        }
    }
}
