package com.wpanther.greengoods.controller;

import com.wpanther.greengoods.dto.AgentMetricsResponse;
import com.wpanther.greengoods.port.AiPort;
import com.wpanther.greengoods.port.LedgerPort;
import com.wpanther.greengoods.port.VoiceProcessor;
import com.wpanther.greengoods.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Controller for retrieving operational metrics of the agent
 */
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
@Slf4j
public class MetricsController {

    private final RateLimiterService rateLimiter;
    private final LedgerPort ledgerPort;
    private final AiPort aiPort;
    private final Optional<VoiceProcessor> voiceProcessor;

    @GetMapping
    public ResponseEntity<AgentMetricsResponse> getMetrics() {
        return ResponseEntity.ok(AgentMetricsResponse.builder()
                .rateLimiter(rateLimiter.getStats())
                .chainId(chainId())
                .aiModelLoaded(aiPort.isModelLoaded())
                .voiceEnabled(voiceProcessor.isPresent())
                .build());
    }

    private Long chainId() {
        try {
            return ledgerPort.getChainId();
        } catch (Exception e) {
            log.debug("Chain id unavailable: {}", e.getMessage());
            return null;
        }
    }
}
