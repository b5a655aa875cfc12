package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.BatchItem;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartMutation;
import com.github.salilvnair.orderbot.validation.ItemValidation;
import com.github.salilvnair.orderbot.validation.ItemValidationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Adds every item of a multi-item message, validating each one independently.
 * One bad item does not stop the others.
 */
@Component
@RequiredArgsConstructor
public class BatchAddItemHandler implements IntentHandler {

    private final ItemValidationService validationService;
    private final OrderingStore store;

    @Override
    public String name() {
        return IntentCode.BATCH_ADD_ITEM;
    }

    @Override
    public boolean batchCapable() {
        return true;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.ADD_ITEM) && context.isBatch();
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        List<Map<String, Object>> added = new ArrayList<>();
        List<Map<String, Object>> failed = new ArrayList<>();

        for (BatchItem batchItem : context.getBatchItems()) {
            ItemValidation validation = validationService.validateFullItem(batchItem.item(), batchItem.size());
            if (!validation.valid()) {
                failed.add(failure(batchItem, validation.message()));
                continue;
            }
            CartMutation mutation = store.addToCart(context.getUserId(), validation.size().id(), batchItem.quantity());
            if (!mutation.success()) {
                failed.add(failure(batchItem, mutation.message()));
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", validation.item().name());
            entry.put("size", validation.size().size());
            entry.put("quantity", batchItem.quantity());
            added.add(entry);
        }

        Map<String, Object> result;
        if (added.isEmpty()) {
            String reasons = failed.stream()
                    .map(f -> f.get("item") + " (" + f.get("error") + ")")
                    .collect(Collectors.joining("; "));
            result = HandlerResults.failure("Couldn't add any items: " + reasons);
        } else {
            StringBuilder message = new StringBuilder("Added ")
                    .append(added.size())
                    .append(" items to cart: ")
                    .append(added.stream()
                            .map(a -> a.get("name") + " (" + a.get("size") + ") x" + a.get("quantity"))
                            .collect(Collectors.joining(", ")));
            if (!failed.isEmpty()) {
                message.append("\n\nCouldn't add: ")
                        .append(failed.stream()
                                .map(f -> f.get("item") + " (" + f.get("error") + ")")
                                .collect(Collectors.joining(", ")));
            }
            result = HandlerResults.success(message.toString());
        }
        result.put(ResultKey.ADDED_ITEMS, added);
        result.put(ResultKey.FAILED_ITEMS, failed);
        result.put(ResultKey.TOTAL_ITEMS, context.getBatchItems().size());
        context.setHandlerResult(result);
        return context;
    }

    private Map<String, Object> failure(BatchItem batchItem, String error) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("item", batchItem.item());
        entry.put("error", error);
        return entry;
    }
}
