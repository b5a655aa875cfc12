package com.github.salilvnair.orderbot.engine.model;

import com.github.salilvnair.orderbot.recommendation.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one processed message. Every field is always present, failures included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseEnvelope {
    private boolean success;
    private String userMessage;
    private String botResponse;
    private String intent;
    private String nlpSource;
    private double confidence;
    private String handlerName;
    private boolean handlerExecuted;

    @Builder.Default
    private Map<String, Object> handlerResult = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> cart = new LinkedHashMap<>();

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> suggestedActions = new ArrayList<>();

    private boolean clarificationNeeded;
    private String clarificationQuestion;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
