package com.github.salilvnair.orderbot.engine.hook;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;

public interface DialogueStepHook {

    default boolean supports(DialogueStep.Name stepName, DialogueContext context) {
        return supports(stepName == null ? null : stepName.name(), context);
    }

    default boolean supports(String stepName, DialogueContext context) {
        return true;
    }

    default void beforeStep(DialogueStep.Name stepName, DialogueContext context) {
        beforeStep(stepName == null ? null : stepName.name(), context);
    }

    default void beforeStep(String stepName, DialogueContext context) {
    }

    default void afterStep(DialogueStep.Name stepName, DialogueContext context, StepResult result) {
        afterStep(stepName == null ? null : stepName.name(), context, result);
    }

    default void afterStep(String stepName, DialogueContext context, StepResult result) {
    }

    default void onStepError(DialogueStep.Name stepName, DialogueContext context, Throwable error) {
        onStepError(stepName == null ? null : stepName.name(), context, error);
    }

    default void onStepError(String stepName, DialogueContext context, Throwable error) {
    }
}
