package com.wpanther.greengoods.controller;

import com.wpanther.greengoods.dto.message.InboundMessage;
import com.wpanther.greengoods.dto.message.OutboundResponse;
import com.wpanther.greengoods.orchestration.MessageOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound endpoint for platform adapters
 */
@RestController
@RequestMapping("/api/v1/messages")
@RequiredArgsConstructor
@Slf4j
public class MessageController {

    private final MessageOrchestrator orchestrator;

    /**
     * Handle one normalized message and return the reply to render
     */
    @PostMapping
    public ResponseEntity<OutboundResponse> handleMessage(@Valid @RequestBody InboundMessage message) {
        log.debug("Inbound message: id={}, platform={}, type={}",
                message.getId(), message.getPlatform().getCode(), message.getContent().kind());

        return ResponseEntity.ok(orchestrator.handle(message));
    }
}
