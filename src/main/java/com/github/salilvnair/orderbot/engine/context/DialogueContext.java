package com.github.salilvnair.orderbot.engine.context;

import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.model.*;
import com.github.salilvnair.orderbot.recommendation.Recommendation;
import com.github.salilvnair.orderbot.store.model.CartSnapshot;
import com.github.salilvnair.orderbot.store.model.UserProfile;
import com.github.salilvnair.orderbot.util.NumberParsing;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-turn record threaded through every pipeline step. Created for one incoming message
 * and discarded afterwards; only history entries and the {@link SessionState} outlive it.
 */
@Getter
@Setter
public class DialogueContext {

    private final Long userId;
    private final String userMessage;

    private String language = LanguageCode.EN;
    private String intent;
    private Map<String, Object> entities = new LinkedHashMap<>();
    private ExtractionSource source = ExtractionSource.NONE;
    private double confidence;
    private List<BatchItem> batchItems = List.of();

    private List<ConversationTurn> history = List.of();
    private UserProfile user;
    private CartSnapshot cart = CartSnapshot.empty();
    private SessionState sessionState = new SessionState();

    private boolean handlerExecuted;
    private String handlerName;
    private Map<String, Object> handlerResult = new LinkedHashMap<>();

    private String botResponse;
    private List<Recommendation> recommendations = new ArrayList<>();
    private List<String> suggestedActions = new ArrayList<>();

    private boolean clarificationNeeded;
    private String clarificationQuestion;

    private ResponseEnvelope finalResponse;
    private final List<StepTiming> stepTimings = new ArrayList<>();

    public DialogueContext(Long userId, String userMessage) {
        this.userId = userId;
        this.userMessage = userMessage == null ? "" : userMessage;
    }

    public void applyExtraction(ExtractionResult extraction) {
        this.language = extraction.language() == null ? LanguageCode.EN : extraction.language();
        this.intent = extraction.intent();
        this.entities = new LinkedHashMap<>(extraction.entities());
        this.source = extraction.source();
        this.confidence = extraction.confidence();
        this.batchItems = extraction.batchItems();
    }

    /** Replaces the entity map as a whole. */
    public void replaceEntities(Map<String, Object> entities) {
        this.entities = entities == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entities);
    }

    public Object entity(String key) {
        return entities.get(key);
    }

    public String entityText(String key) {
        Object value = entities.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public Integer entityInt(String key) {
        Object value = entities.get(key);
        if (value instanceof Number number) {
            return NumberParsing.saturatedInt(number);
        }
        if (value instanceof String s && s.trim().matches("\\d+")) {
            return NumberParsing.saturatedInt(s);
        }
        return null;
    }

    public boolean hasIntent() {
        return intent != null && !intent.isBlank();
    }

    public boolean isIntent(String code) {
        return code != null && code.equals(intent);
    }

    public boolean isBatch() {
        return batchItems != null && batchItems.size() >= 2;
    }

    public boolean hasReply() {
        return botResponse != null && !botResponse.isBlank();
    }

    public boolean isHandlerSuccess() {
        return handlerExecuted && Boolean.TRUE.equals(handlerResult.get(ResultKey.SUCCESS));
    }

    public DialogueState getDialogueState() {
        return sessionState.getDialogueState();
    }

    public void setDialogueState(DialogueState state) {
        sessionState.setDialogueState(state == null ? DialogueState.IDLE : state);
    }
}
