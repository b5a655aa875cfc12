package com.github.salilvnair.orderbot.engine.model;

import java.time.Instant;
import java.util.Map;

public record ConversationTurn(
        String role,
        String content,
        Map<String, Object> metadata,
        Instant createdAt
) {}
