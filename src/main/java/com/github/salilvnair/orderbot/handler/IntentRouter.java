package com.github.salilvnair.orderbot.handler;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.handler.impl.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered handler registry; the first handler whose predicate accepts the context wins.
 * <p>
 * Registration order:
 * <ol>
 *     <li>batch add (2+ parsed items)</li>
 *     <li>single add (item entity present)</li>
 *     <li>remove</li>
 *     <li>view cart</li>
 *     <li>checkout (non-empty cart)</li>
 *     <li>browse menu</li>
 *     <li>clear cart</li>
 *     <li>confirmation</li>
 *     <li>rejection</li>
 * </ol>
 * The batch handler must precede the single-item handler, whose predicate also accepts a batch.
 */
@Slf4j
@Component
public class IntentRouter {

    private final List<IntentHandler> handlers;

    @Autowired
    public IntentRouter(
            BatchAddItemHandler batchAddItemHandler,
            AddItemHandler addItemHandler,
            RemoveItemHandler removeItemHandler,
            ViewCartHandler viewCartHandler,
            CheckoutHandler checkoutHandler,
            BrowseMenuHandler browseMenuHandler,
            ClearCartHandler clearCartHandler,
            ConfirmationHandler confirmationHandler,
            RejectionHandler rejectionHandler
    ) {
        this(List.of(
                batchAddItemHandler,
                addItemHandler,
                removeItemHandler,
                viewCartHandler,
                checkoutHandler,
                browseMenuHandler,
                clearCartHandler,
                confirmationHandler,
                rejectionHandler
        ));
    }

    public IntentRouter(List<IntentHandler> handlers) {
        verifyBatchPrecedesSingle(handlers);
        this.handlers = List.copyOf(handlers);
        log.info("Intent router order: {}",
                this.handlers.stream().map(IntentHandler::name).collect(Collectors.joining(" -> ")));
    }

    public List<IntentHandler> handlers() {
        return handlers;
    }

    public Optional<IntentHandler> route(DialogueContext context) {
        for (IntentHandler handler : handlers) {
            if (handler.canHandle(context)) {
                return Optional.of(handler);
            }
        }
        return Optional.empty();
    }

    public DialogueContext dispatch(DialogueContext context) {
        Optional<IntentHandler> routed = route(context);
        if (routed.isEmpty()) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(ResultKey.SUCCESS, false);
            result.put(ResultKey.ERROR, "No handler for intent: " + context.getIntent());
            result.put(ResultKey.FALLBACK_TO_LLM, true);
            context.setHandlerExecuted(false);
            context.setHandlerName(null);
            context.setHandlerResult(result);
            log.debug("No handler for intent={} userId={}", context.getIntent(), context.getUserId());
            return context;
        }

        IntentHandler handler = routed.get();
        context.setHandlerName(handler.name());
        try {
            DialogueContext out = handler.execute(context);
            out.setHandlerExecuted(true);
            out.setHandlerName(handler.name());
            return out;
        } catch (RuntimeException e) {
            log.warn("Handler {} failed for userId={}: {}", handler.name(), context.getUserId(), e.getMessage(), e);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(ResultKey.SUCCESS, false);
            result.put(ResultKey.ERROR, "Error handling " + context.getIntent() + ": " + e.getMessage());
            context.setHandlerExecuted(true);
            context.setHandlerResult(result);
            return context;
        }
    }

    private static void verifyBatchPrecedesSingle(List<IntentHandler> handlers) {
        int firstSingle = -1;
        int lastBatch = -1;
        for (int i = 0; i < handlers.size(); i++) {
            IntentHandler handler = handlers.get(i);
            if (handler.batchCapable()) {
                lastBatch = i;
            } else if (firstSingle < 0 && IntentCode.ADD_ITEM.equals(handler.name())) {
                firstSingle = i;
            }
        }
        if (firstSingle >= 0 && lastBatch > firstSingle) {
            throw new DialogueEngineException(
                    DialogueEngineErrorCode.HANDLER_ORDER_VIOLATION,
                    "Batch add handler must be registered before the single add handler"
            );
        }
    }
}
