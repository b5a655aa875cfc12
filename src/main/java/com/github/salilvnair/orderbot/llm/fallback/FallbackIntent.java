package com.github.salilvnair.orderbot.llm.fallback;

import java.util.Map;

public record FallbackIntent(String intent, Map<String, Object> entities, Double confidence) {

    public FallbackIntent {
        entities = entities == null ? Map.of() : entities;
    }
}
