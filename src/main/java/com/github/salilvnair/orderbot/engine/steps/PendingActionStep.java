package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.clarification.ClarificationService;
import com.github.salilvnair.orderbot.clarification.PendingResolution;
import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.DialogueState;
import com.github.salilvnair.orderbot.engine.model.PendingAction;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies a follow-up message to the outstanding pending action, if any.
 * <ul>
 *   <li>no intent, or the pending intent again: merge and resolve</li>
 *   <li>another intent: discard the pending action</li>
 *   <li>retry budget spent: discard and handle the message as new</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@MustRunAfter(LoadStateStep.class)
public class PendingActionStep implements DialogueStep {

    private final ClarificationService clarificationService;
    private final OrderBotProperties properties;

    @Override
    public StepResult execute(DialogueContext context) {
        SessionState state = context.getSessionState();
        PendingAction action = state.getPendingAction();
        if (action == null) {
            return new StepResult.Continue();
        }

        boolean continuesAction = !context.hasIntent() || context.isIntent(action.getActionType());
        if (!continuesAction || context.isBatch()) {
            log.debug("userId={} dropping pending {} for new intent {}", context.getUserId(), action.getActionType(), context.getIntent());
            discard(state);
            return new StepResult.Continue();
        }
        if (action.getRetryCount() >= properties.getDialogue().getPendingActionMaxRetries()) {
            log.debug("userId={} pending {} gave up after {} retries", context.getUserId(), action.getActionType(), action.getRetryCount());
            discard(state);
            return new StepResult.Continue();
        }

        PendingResolution resolution = clarificationService.resolvePendingAction(
                state, context.getUserMessage(), context.getEntities());
        context.setIntent(resolution.intent());
        context.replaceEntities(resolution.entities());
        if (resolution.resolved()) {
            return new StepResult.Continue();
        }

        String question = clarificationService.generateQuestion(
                resolution.intent(), resolution.entities(), resolution.stillMissing(),
                context.getLanguage(), context.getCart());
        context.setClarificationNeeded(true);
        context.setClarificationQuestion(question);
        context.setBotResponse(question);
        context.setHandlerExecuted(false);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.CLARIFICATION_NEEDED, true);
        result.put(ResultKey.MISSING_FIELDS, resolution.stillMissing());
        context.setHandlerResult(result);
        return new StepResult.Continue();
    }

    private void discard(SessionState state) {
        state.setPendingAction(null);
        if (state.getDialogueState() != DialogueState.AWAITING_CONFIRMATION) {
            state.setDialogueState(DialogueState.IDLE);
        }
    }
}
