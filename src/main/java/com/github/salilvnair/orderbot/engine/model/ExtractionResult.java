package com.github.salilvnair.orderbot.engine.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standardized output of intent/entity extraction for one message.
 * {@code intent} is null when nothing understood the message.
 */
public record ExtractionResult(
        String intent,
        Map<String, Object> entities,
        String language,
        ExtractionSource source,
        double confidence,
        List<BatchItem> batchItems
) {

    public ExtractionResult {
        entities = entities == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entities);
        batchItems = batchItems == null ? List.of() : List.copyOf(batchItems);
    }

    public static ExtractionResult noMatch(String language, ExtractionSource source) {
        return new ExtractionResult(null, Map.of(), language, source, 0.0d, List.of());
    }

    public boolean hasIntent() {
        return intent != null && !intent.isBlank();
    }

    public boolean isBatch() {
        return batchItems.size() >= 2;
    }
}
