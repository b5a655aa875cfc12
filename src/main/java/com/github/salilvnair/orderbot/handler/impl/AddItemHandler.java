package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.PendingSuggestion;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.CartLimits;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartMutation;
import com.github.salilvnair.orderbot.suggestion.SuggestionService;
import com.github.salilvnair.orderbot.validation.ItemValidation;
import com.github.salilvnair.orderbot.validation.ItemValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds one validated item to the cart. When the item is unknown but similar items exist,
 * proposes the closest one as a pending suggestion and asks for a yes/no.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AddItemHandler implements IntentHandler {

    private final ItemValidationService validationService;
    private final OrderingStore store;
    private final SuggestionService suggestionService;

    @Override
    public String name() {
        return IntentCode.ADD_ITEM;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.ADD_ITEM) && context.getEntities().get(EntityKey.ITEM) != null;
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        String item = context.entityText(EntityKey.ITEM);
        String size = context.entityText(EntityKey.SIZE);
        Integer requested = context.entityInt(EntityKey.QUANTITY);
        int quantity = requested == null || requested < 1 ? 1 : requested;
        String rejection = CartLimits.rejectionFor(quantity);
        if (rejection != null) {
            context.setHandlerResult(HandlerResults.failure(rejection));
            return context;
        }

        ItemValidation validation = validationService.validateFullItem(item, size);
        if (!validation.valid()) {
            if (validation.status() == ItemValidation.Status.SIMILAR_FOUND) {
                return suggest(context, item, size, quantity, validation);
            }
            Map<String, Object> result = HandlerResults.failure(validation.message());
            result.put(ResultKey.SUGGESTION, validationService.availableSizesText(validation.item()));
            context.setHandlerResult(result);
            return context;
        }

        CartMutation mutation = store.addToCart(context.getUserId(), validation.size().id(), quantity);
        if (!mutation.success()) {
            context.setHandlerResult(HandlerResults.failure(mutation.message()));
            return context;
        }

        Map<String, Object> added = new LinkedHashMap<>();
        added.put("name", validation.item().name());
        added.put("size", validation.size().size());
        added.put("price", validation.size().price());
        added.put("quantity", mutation.line() == null ? quantity : mutation.line().quantity());

        Map<String, Object> result = HandlerResults.success(mutation.message());
        result.put(ResultKey.ITEM, added);
        context.setHandlerResult(result);
        return context;
    }

    private DialogueContext suggest(
            DialogueContext context,
            String item,
            String size,
            int quantity,
            ItemValidation validation
    ) {
        String best = validation.bestSuggestion();
        PendingSuggestion suggestion = suggestionService.createAddItemSuggestion(best, size, quantity);
        suggestionService.setPendingSuggestion(context.getSessionState(), suggestion);

        String question;
        if (LanguageCode.isArabic(context.getLanguage())) {
            question = "لم أجد '" + item + "'. هل تقصد " + best + "؟";
        } else {
            StringBuilder proposal = new StringBuilder();
            if (quantity > 1) {
                proposal.append(quantity).append(' ');
            }
            if (size != null) {
                proposal.append(size).append(' ');
            }
            proposal.append(best);
            question = "I couldn't find '" + item + "'. Did you mean " + proposal + "? (Say 'yes' to add it)";
        }
        log.debug("Suggesting '{}' for unknown item '{}' userId={}", best, item, context.getUserId());

        Map<String, Object> result = HandlerResults.failure(validation.message());
        result.put(ResultKey.SUGGESTION_CREATED, true);
        result.put(ResultKey.MESSAGE, question);
        context.setHandlerResult(result);
        context.setBotResponse(question);
        return context;
    }
}
