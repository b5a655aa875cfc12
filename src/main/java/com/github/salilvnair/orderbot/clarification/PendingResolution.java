package com.github.salilvnair.orderbot.clarification;

import java.util.List;
import java.util.Map;

/**
 * Outcome of applying a follow-up message to an outstanding pending action.
 */
public record PendingResolution(
        boolean resolved,
        String intent,
        Map<String, Object> entities,
        List<String> stillMissing
) {}
