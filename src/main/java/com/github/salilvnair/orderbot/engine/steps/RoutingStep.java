package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.orderbot.handler.IntentRouter;
import com.github.salilvnair.orderbot.store.OrderingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@MustRunAfter(ClarificationStep.class)
public class RoutingStep implements DialogueStep {

    private final IntentRouter router;
    private final OrderingStore store;

    @Override
    public StepResult execute(DialogueContext context) {
        if (context.hasReply()) {
            return new StepResult.Continue();
        }
        router.dispatch(context);
        if (context.isHandlerExecuted() && IntentCode.CART_MUTATING.contains(context.getHandlerName())) {
            context.setCart(store.getCart(context.getUserId()));
        }
        return new StepResult.Continue();
    }
}
