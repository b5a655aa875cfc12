package com.github.salilvnair.orderbot.engine.pipeline;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;

public interface DialogueStep {
    StepResult execute(DialogueContext context);

    enum Name {
        ExtractStep,
        LoadStateStep,
        PendingActionStep,
        ClarificationStep,
        RoutingStep,
        ResponseStep,
        PersistStep,
        Unknown;

        public static Name fromStepName(String stepName) {
            if (stepName == null || stepName.isBlank()) {
                return Unknown;
            }
            for (Name value : values()) {
                if (value.name().equalsIgnoreCase(stepName.trim())) {
                    return value;
                }
            }
            return Unknown;
        }

        public static Name fromStepClass(Class<?> stepClass) {
            if (stepClass == null) {
                return Unknown;
            }
            return fromStepName(stepClass.getSimpleName());
        }
    }
}
