package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartLine;
import com.github.salilvnair.orderbot.store.model.CheckoutResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the cart into an order. Only offered when the loaded cart snapshot is non-empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckoutHandler implements IntentHandler {

    private final OrderingStore store;

    @Override
    public String name() {
        return IntentCode.CHECKOUT;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.CHECKOUT) && context.getCart() != null && !context.getCart().isEmpty();
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        CheckoutResult checkout = store.checkout(context.getUserId());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, checkout.success());
        result.put(ResultKey.MESSAGE, checkout.message());
        if (checkout.success()) {
            result.put(ResultKey.ORDER_ID, checkout.orderId());
            result.put(ResultKey.TOTAL_PRICE, checkout.totalPrice());
            result.put(ResultKey.ITEMS, checkout.items().stream().map(CartLine::toMap).toList());
            log.info("Order #{} placed for userId={} total={}", checkout.orderId(), context.getUserId(), checkout.totalPrice());
        } else {
            result.put(ResultKey.ERROR, checkout.message());
        }
        context.setHandlerResult(result);
        return context;
    }
}
