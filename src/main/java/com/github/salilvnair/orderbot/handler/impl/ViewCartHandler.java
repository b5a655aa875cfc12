package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartLine;
import com.github.salilvnair.orderbot.store.model.CartSnapshot;
import com.github.salilvnair.orderbot.util.MoneyFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ViewCartHandler implements IntentHandler {

    private final OrderingStore store;

    @Override
    public String name() {
        return IntentCode.VIEW_CART;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.VIEW_CART);
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        CartSnapshot cart = store.getCart(context.getUserId());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, true);
        result.put(ResultKey.SUMMARY, summary(cart));
        result.put(ResultKey.ITEMS, cart.items().stream().map(CartLine::toMap).toList());
        result.put(ResultKey.TOTAL_PRICE, cart.totalPrice());
        context.setHandlerResult(result);
        return context;
    }

    static String summary(CartSnapshot cart) {
        if (cart.isEmpty()) {
            return "Your cart is empty";
        }
        StringBuilder sb = new StringBuilder("Current Cart:\n");
        for (CartLine line : cart.items()) {
            sb.append("  • ").append(line.itemName())
                    .append(" (").append(line.size()).append(") x").append(line.quantity())
                    .append(" = ").append(MoneyFormat.withCurrency(line.subtotal()))
                    .append('\n');
        }
        sb.append("\nTotal: ").append(MoneyFormat.withCurrency(cart.totalPrice()));
        return sb.toString();
    }
}
