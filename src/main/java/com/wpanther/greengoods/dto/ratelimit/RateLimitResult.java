package com.wpanther.greengoods.dto.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitResult {

    private boolean allowed;

    private int remaining;

    // Milliseconds until the oldest retained request leaves the window
    private long resetIn;

    private int limit;

    // User-facing explanation, only set on denial
    private String message;
}
