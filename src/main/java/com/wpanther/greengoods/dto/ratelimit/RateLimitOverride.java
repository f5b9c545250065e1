package com.wpanther.greengoods.dto.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call replacement for the configured limit of an action class. Null fields fall back to configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitOverride {

    private Integer maxRequests;

    private Long windowMs;

    private String message;
}
