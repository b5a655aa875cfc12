package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.engine.constants.HistoryRole;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.orderbot.store.OrderingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the turn back to the store (history and session state) and builds the final response.
 */
@Component
@TerminalStep
@RequiredArgsConstructor
@MustRunAfter(ResponseStep.class)
public class PersistStep implements DialogueStep {

    private final OrderingStore store;

    @Override
    public StepResult execute(DialogueContext context) {
        Long userId = context.getUserId();

        // HashMap: intent may be null
        Map<String, Object> userMeta = new HashMap<>();
        userMeta.put("intent", context.getIntent());
        userMeta.put("nlp_source", context.getSource().value());
        userMeta.put("confidence", context.getConfidence());
        store.appendHistory(userId, HistoryRole.USER, context.getUserMessage(), userMeta);

        Map<String, Object> botMeta = new HashMap<>();
        botMeta.put("handler", context.getHandlerName());
        botMeta.put("handler_executed", context.isHandlerExecuted());
        botMeta.put("intent", context.getIntent());
        store.appendHistory(userId, HistoryRole.ASSISTANT, context.getBotResponse(), botMeta);

        store.saveSessionState(userId, context.getSessionState());

        ResponseEnvelope envelope = ResponseEnvelope.builder()
                .success(true)
                .userMessage(context.getUserMessage())
                .botResponse(context.getBotResponse())
                .intent(context.getIntent())
                .nlpSource(context.getSource().value())
                .confidence(context.getConfidence())
                .handlerName(context.getHandlerName())
                .handlerExecuted(context.isHandlerExecuted())
                .handlerResult(new LinkedHashMap<>(context.getHandlerResult()))
                .cart(context.getCart().toMap())
                .recommendations(new ArrayList<>(context.getRecommendations()))
                .suggestedActions(new ArrayList<>(context.getSuggestedActions()))
                .clarificationNeeded(context.isClarificationNeeded())
                .clarificationQuestion(context.getClarificationQuestion())
                .metadata(metadata(context))
                .build();
        context.setFinalResponse(envelope);
        return new StepResult.Stop(envelope);
    }

    static Map<String, Object> metadata(DialogueContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("language", context.getLanguage());
        metadata.put("entities", new LinkedHashMap<>(context.getEntities()));
        metadata.put("dialogue_state", context.getDialogueState().value());
        metadata.put("batch_item_count", context.getBatchItems() == null ? 0 : context.getBatchItems().size());
        if (context.getSessionState().hasPendingSuggestion()) {
            metadata.put("pending_suggestion", context.getSessionState().getPendingSuggestion().getItem());
        }
        return metadata;
    }
}
