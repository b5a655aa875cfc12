package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.nlp.ItemTextNormalizer;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartLine;
import com.github.salilvnair.orderbot.store.model.CartMutation;
import com.github.salilvnair.orderbot.store.model.CartSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Removes a cart line, or part of it when a quantity is given ("remove 1 cola").
 */
@Component
@RequiredArgsConstructor
public class RemoveItemHandler implements IntentHandler {

    private final OrderingStore store;
    private final ItemTextNormalizer normalizer;

    @Override
    public String name() {
        return IntentCode.REMOVE_ITEM;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.REMOVE_ITEM) && context.entityText(EntityKey.ITEM) != null;
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        String reference = context.entityText(EntityKey.ITEM);
        Integer quantity = null;
        Optional<ItemTextNormalizer.Quantified> quantified = normalizer.leadingQuantity(reference, context.getLanguage());
        if (quantified.isPresent()) {
            quantity = quantified.get().quantity();
            reference = quantified.get().remaining();
        }
        String target = normalizer.cleanItemName(reference, context.getLanguage());

        CartSnapshot cart = store.getCart(context.getUserId());
        if (cart.isEmpty()) {
            context.setHandlerResult(HandlerResults.failure("Your cart is empty"));
            return context;
        }
        Optional<CartLine> line = findLine(cart, target);
        if (line.isEmpty()) {
            context.setHandlerResult(HandlerResults.failure("'" + target + "' is not in your cart"));
            return context;
        }

        CartLine found = line.get();
        CartMutation mutation;
        if (quantity == null || quantity >= found.quantity()) {
            mutation = store.removeFromCart(context.getUserId(), found.menuSizeId());
        } else {
            int remaining = found.quantity() - quantity;
            mutation = store.updateQuantity(context.getUserId(), found.menuSizeId(), remaining);
            if (mutation.success()) {
                mutation = new CartMutation(true,
                        "Removed " + quantity + "x " + found.itemName() + " from cart (" + remaining + " left)",
                        mutation.line());
            }
        }
        context.setHandlerResult(mutation.success()
                ? HandlerResults.success(mutation.message())
                : HandlerResults.failure(mutation.message()));
        return context;
    }

    private Optional<CartLine> findLine(CartSnapshot cart, String target) {
        if (target == null || target.isBlank()) {
            return Optional.empty();
        }
        String needle = target.toLowerCase(Locale.ROOT);
        return cart.items().stream()
                .filter(l -> {
                    String name = l.itemName().toLowerCase(Locale.ROOT);
                    return name.contains(needle) || needle.contains(name);
                })
                .findFirst();
    }
}
