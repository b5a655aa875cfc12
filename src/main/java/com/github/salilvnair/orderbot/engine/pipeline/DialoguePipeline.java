package com.github.salilvnair.orderbot.engine.pipeline;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.engine.model.ResponseEnvelope;

import java.util.List;

public final class DialoguePipeline {

    private final List<DialogueStep> steps;

    public DialoguePipeline(List<DialogueStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public ResponseEnvelope execute(DialogueContext context) {
        for (DialogueStep step : steps) {
            StepResult r = step.execute(context);
            if (r instanceof StepResult.Stop stop) {
                return stop.result();
            }
        }
        // PersistStep must have set finalResponse
        if (context.getFinalResponse() == null) {
            throw new DialogueEngineException(
                    DialogueEngineErrorCode.PIPELINE_NO_FINAL_RESULT
            );
        }
        return context.getFinalResponse();
    }

    public List<DialogueStep> steps() {
        return steps;
    }
}
