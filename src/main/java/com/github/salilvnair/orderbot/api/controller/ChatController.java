package com.github.salilvnair.orderbot.api.controller;

import com.github.salilvnair.orderbot.api.dto.ChatRequest;
import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.core.DialogueEngine;
import com.github.salilvnair.orderbot.engine.model.ConversationTurn;
import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;
import com.github.salilvnair.orderbot.store.OrderingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final DialogueEngine engine;
    private final OrderingStore store;
    private final OrderBotProperties properties;

    @PostMapping("/message")
    public ResponseEntity<ResponseEnvelope> message(@RequestBody ChatRequest request) {
        if (request.getUserId() == null || request.getMessage() == null || request.getMessage().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(engine.processMessage(request.getUserId(), request.getMessage().trim()));
    }

    @GetMapping("/history/{userId}")
    public List<ConversationTurn> history(@PathVariable("userId") Long userId) {
        return store.getHistory(userId, properties.getDialogue().getHistoryLimit());
    }
}
