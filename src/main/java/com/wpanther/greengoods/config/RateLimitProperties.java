package com.wpanther.greengoods.config;

import com.wpanther.greengoods.dto.ratelimit.ActionClass;
import com.wpanther.greengoods.dto.ratelimit.RateLimitOverride;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per action class limits, bound from {@code app.rate-limit.*}. Unset fields keep the built-in defaults.
 */
@Data
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    private static final Map<ActionClass, RateLimitOverride> DEFAULTS = new EnumMap<>(ActionClass.class);

    static {
        DEFAULTS.put(ActionClass.MESSAGE, new RateLimitOverride(10, 60_000L,
                "You're sending messages too quickly. Please wait a moment."));
        DEFAULTS.put(ActionClass.COMMAND, new RateLimitOverride(20, 60_000L,
                "Too many commands. Please slow down."));
        DEFAULTS.put(ActionClass.SUBMISSION, new RateLimitOverride(5, 300_000L,
                "You've submitted too many works recently. Please wait before submitting again."));
        DEFAULTS.put(ActionClass.VOICE, new RateLimitOverride(3, 60_000L,
                "Voice processing is limited. Please wait before sending another voice message."));
        // Operators review batches, so approvals get a higher allowance than submissions
        DEFAULTS.put(ActionClass.APPROVAL, new RateLimitOverride(30, 60_000L,
                "Too many approval actions. Please wait."));
        DEFAULTS.put(ActionClass.WALLET, new RateLimitOverride(5, 300_000L,
                "Too many wallet operations. Please wait."));
    }

    /**
     * Keyed by action class code: message, command, submission, voice, approval, wallet.
     */
    private Map<String, RateLimitOverride> limits = new HashMap<>();

    private long cleanupIntervalMs = 60_000L;

    /**
     * Effective limit of one class: configured fields over defaults.
     */
    public RateLimitOverride resolve(ActionClass actionClass) {
        RateLimitOverride defaults = DEFAULTS.get(actionClass);
        RateLimitOverride configured = limits.get(actionClass.getCode());
        if (configured == null) {
            configured = limits.get(actionClass.name().toLowerCase(Locale.ROOT));
        }
        return merge(defaults, configured);
    }

    public static RateLimitOverride merge(RateLimitOverride base, RateLimitOverride override) {
        if (override == null) {
            return new RateLimitOverride(base.getMaxRequests(), base.getWindowMs(), base.getMessage());
        }
        return new RateLimitOverride(
                override.getMaxRequests() != null ? override.getMaxRequests() : base.getMaxRequests(),
                override.getWindowMs() != null ? override.getWindowMs() : base.getWindowMs(),
                override.getMessage() != null ? override.getMessage() : base.getMessage());
    }
}
