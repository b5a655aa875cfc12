package com.github.salilvnair.orderbot.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingAction {

    private String actionType;

    @Builder.Default
    private List<String> missingFields = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> partialData = new LinkedHashMap<>();

    private Instant createdAt;
    private int retryCount;
}
