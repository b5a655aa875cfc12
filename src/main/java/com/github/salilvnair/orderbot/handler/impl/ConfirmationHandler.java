package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.PendingSuggestion;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartMutation;
import com.github.salilvnair.orderbot.store.model.MenuItemView;
import com.github.salilvnair.orderbot.store.model.MenuSizeView;
import com.github.salilvnair.orderbot.suggestion.SuggestionLookup;
import com.github.salilvnair.orderbot.suggestion.SuggestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * "yes" to a pending suggestion. The suggestion is consumed on the first confirmation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfirmationHandler implements IntentHandler {

    private final SuggestionService suggestionService;
    private final OrderingStore store;

    @Override
    public String name() {
        return IntentCode.CONFIRMATION;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.CONFIRMATION);
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        boolean ar = LanguageCode.isArabic(context.getLanguage());
        SuggestionLookup lookup = suggestionService.lookup(context.getSessionState());

        if (lookup.status() == SuggestionLookup.Status.NONE) {
            context.setHandlerResult(HandlerResults.failure(ar
                    ? "مش متأكد إنت بتأكد على إيه. عايز تطلب إيه؟"
                    : "I'm not sure what you're confirming. What would you like to order?"));
            return context;
        }
        if (lookup.status() == SuggestionLookup.Status.EXPIRED) {
            Map<String, Object> result = HandlerResults.failure(ar
                    ? "الاقتراح ده انتهى. عايز تطلب إيه؟"
                    : "That suggestion has expired. What would you like to order?");
            result.put(ResultKey.EXPIRED, true);
            context.setHandlerResult(result);
            return context;
        }

        PendingSuggestion suggestion = lookup.suggestion();
        suggestionService.clear(context.getSessionState());

        Optional<MenuItemView> item = store.getMenuItem(suggestion.getItem(), true)
                .or(() -> store.getMenuItem(suggestion.getItem(), false));
        if (item.isEmpty()) {
            context.setHandlerResult(HandlerResults.failure(
                    "Sorry, '" + suggestion.getItem() + "' is no longer on the menu."));
            return context;
        }
        Optional<MenuSizeView> size = pickSize(item.get(), suggestion.getSize());
        if (size.isEmpty()) {
            context.setHandlerResult(HandlerResults.failure(item.get().name() + " has no available sizes"));
            return context;
        }

        CartMutation mutation = store.addToCart(context.getUserId(), size.get().id(), suggestion.getQuantity());
        if (!mutation.success()) {
            context.setHandlerResult(HandlerResults.failure(mutation.message()));
            return context;
        }
        log.debug("Confirmed suggestion {} x{} userId={}", item.get().name(), suggestion.getQuantity(), context.getUserId());
        String message = ar
                ? "✅ تم إضافة " + suggestion.getQuantity() + " " + item.get().name() + " للسلة!"
                : "✅ Added " + suggestion.getQuantity() + "x " + size.get().size() + " " + item.get().name() + " to your cart!";
        Map<String, Object> result = HandlerResults.success(message);
        result.put(ResultKey.ITEM, Map.of(
                "name", item.get().name(),
                "size", size.get().size(),
                "quantity", suggestion.getQuantity()
        ));
        context.setHandlerResult(result);
        return context;
    }

    /** Suggested size if offered, else REG, else the first available size. */
    private Optional<MenuSizeView> pickSize(MenuItemView item, String suggestedSize) {
        List<MenuSizeView> available = item.availableSizes();
        for (String code : new String[]{suggestedSize, "REG"}) {
            if (code == null) {
                continue;
            }
            Optional<MenuSizeView> match = available.stream()
                    .filter(s -> s.size().equalsIgnoreCase(code))
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return available.stream().findFirst();
    }
}
