package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.clarification.ClarificationCheck;
import com.github.salilvnair.orderbot.clarification.ClarificationService;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@MustRunAfter(PendingActionStep.class)
public class ClarificationStep implements DialogueStep {

    private final ClarificationService clarificationService;

    @Override
    public StepResult execute(DialogueContext context) {
        if (context.hasReply() || context.isBatch() || !context.hasIntent()) {
            return new StepResult.Continue();
        }
        ClarificationCheck check = clarificationService.needsClarification(context.getIntent(), context.getEntities());
        if (!check.needed()) {
            return new StepResult.Continue();
        }

        String question = clarificationService.generateQuestion(
                context.getIntent(), context.getEntities(), check.missingFields(),
                context.getLanguage(), context.getCart());
        clarificationService.openPendingAction(
                context.getSessionState(), context.getIntent(), context.getEntities(), check.missingFields());

        context.setClarificationNeeded(true);
        context.setClarificationQuestion(question);
        context.setBotResponse(question);
        context.setHandlerExecuted(false);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.CLARIFICATION_NEEDED, true);
        result.put(ResultKey.MISSING_FIELDS, check.missingFields());
        context.setHandlerResult(result);
        return new StepResult.Continue();
    }
}
