package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.orderbot.store.OrderingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@MustRunAfter(ExtractStep.class)
public class LoadStateStep implements DialogueStep {

    private final OrderingStore store;
    private final OrderBotProperties properties;

    @Override
    public StepResult execute(DialogueContext context) {
        Long userId = context.getUserId();
        context.setUser(store.getUser(userId));
        context.setCart(store.getCart(userId));
        context.setHistory(store.getHistory(userId, properties.getDialogue().getHistoryLimit()));
        SessionState state = store.loadSessionState(userId);
        context.setSessionState(state == null ? new SessionState() : state);
        return new StepResult.Continue();
    }
}
