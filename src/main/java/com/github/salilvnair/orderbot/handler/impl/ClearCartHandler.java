package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.OrderingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ClearCartHandler implements IntentHandler {

    static final String CLEARED = "Cart cleared! Ready for a new order 🛒";

    private final OrderingStore store;

    @Override
    public String name() {
        return IntentCode.CLEAR_CART;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.CLEAR_CART);
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        store.clearCart(context.getUserId());
        context.setHandlerResult(HandlerResults.success(CLEARED));
        return context;
    }
}
