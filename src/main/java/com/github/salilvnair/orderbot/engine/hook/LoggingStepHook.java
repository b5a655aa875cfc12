package com.github.salilvnair.orderbot.engine.hook;

import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingStepHook implements DialogueStepHook {

    @Override
    public boolean supports(String stepName, DialogueContext context) {
        return log.isDebugEnabled() || log.isWarnEnabled();
    }

    @Override
    public void beforeStep(String stepName, DialogueContext context) {
        log.debug("step={} enter userId={} intent={}", stepName, context.getUserId(), context.getIntent());
    }

    @Override
    public void afterStep(String stepName, DialogueContext context, StepResult result) {
        log.debug("step={} exit userId={} intent={} state={} outcome={}",
                stepName, context.getUserId(), context.getIntent(), context.getDialogueState(),
                result.getClass().getSimpleName());
    }

    @Override
    public void onStepError(String stepName, DialogueContext context, Throwable error) {
        log.warn("step={} failed userId={} intent={}: {}",
                stepName, context.getUserId(), context.getIntent(), error.getMessage());
    }
}
