package com.wpanther.greengoods.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wpanther.greengoods.dto.ratelimit.RateLimiterStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentMetricsResponse {

    private RateLimiterStats rateLimiter;

    // Null when the ledger client is unavailable
    private Long chainId;

    private boolean aiModelLoaded;

    private boolean voiceEnabled;
}
