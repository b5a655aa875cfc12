package com.github.salilvnair.orderbot.engine.provider;

import com.github.salilvnair.orderbot.audit.AuditService;
import com.github.salilvnair.orderbot.audit.DialogueAuditStage;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.core.DialogueEngine;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.engine.factory.DialoguePipelineFactory;
import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultDialogueEngine implements DialogueEngine {

    public static final String APOLOGY = "Sorry, something went wrong while processing your message. Please try again.";

    private final DialoguePipelineFactory pipelineFactory;
    private final AuditService audit;

    @Override
    public ResponseEnvelope processMessage(Long userId, String message) {
        DialogueContext context = new DialogueContext(userId, message);
        try {
            return pipelineFactory.create().execute(context);
        } catch (Exception ex) {
            log.error("Dialogue processing failed for userId={}: {}", userId, ex.getMessage(), ex);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("exception", ex.getClass().getSimpleName());
            payload.put("message", String.valueOf(ex.getMessage()));
            if (ex instanceof DialogueEngineException engineException) {
                payload.put("errorCode", engineException.getErrorCode());
                payload.put("recoverable", engineException.isRecoverable());
            } else {
                payload.put("recoverable", false);
            }
            audit.audit(DialogueAuditStage.ENGINE_FAILURE, userId, payload);
            return failure(context);
        }
    }

    private ResponseEnvelope failure(DialogueContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("language", context.getLanguage());
        metadata.put("error", true);
        return ResponseEnvelope.builder()
                .success(false)
                .userMessage(context.getUserMessage())
                .botResponse(APOLOGY)
                .intent(context.getIntent())
                .nlpSource(context.getSource().value())
                .confidence(context.getConfidence())
                .handlerName(context.getHandlerName())
                .handlerExecuted(false)
                .cart(context.getCart().toMap())
                .clarificationNeeded(context.isClarificationNeeded())
                .clarificationQuestion(context.getClarificationQuestion())
                .metadata(metadata)
                .build();
    }
}
