package com.github.salilvnair.orderbot.audit;

import com.github.salilvnair.orderbot.util.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;

public interface AuditService {
    void audit(String stage, Long userId, String payloadJson);

    default void audit(DialogueAuditStage stage, Long userId, String payloadJson) {
        audit(stage.value(), userId, payloadJson);
    }

    default void audit(String stage, Long userId, Map<String, ?> payload) {
        audit(stage, userId, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }

    default void audit(DialogueAuditStage stage, Long userId, Map<String, ?> payload) {
        audit(stage.value(), userId, payload);
    }

    default void audit(String stage, Long userId, Object payload) {
        if (payload == null) {
            audit(stage, userId, "{}");
            return;
        }
        if (payload instanceof String s) {
            audit(stage, userId, s);
            return;
        }
        if (payload instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((k, v) -> normalized.put(String.valueOf(k), v));
            audit(stage, userId, normalized);
            return;
        }
        audit(stage, userId, JsonUtil.toJson(payload));
    }
}
