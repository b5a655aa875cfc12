package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.handler.IntentHandler;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.MenuItemView;
import com.github.salilvnair.orderbot.store.model.MenuSizeView;
import com.github.salilvnair.orderbot.util.MoneyFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class BrowseMenuHandler implements IntentHandler {

    private final OrderingStore store;

    @Override
    public String name() {
        return IntentCode.BROWSE_MENU;
    }

    @Override
    public boolean canHandle(DialogueContext context) {
        return context.isIntent(IntentCode.BROWSE_MENU);
    }

    @Override
    public DialogueContext execute(DialogueContext context) {
        List<MenuItemView> menu = store.listMenu().stream().filter(MenuItemView::available).toList();
        if (menu.isEmpty()) {
            context.setHandlerResult(HandlerResults.failure("The menu is not available right now"));
            return context;
        }
        Map<String, List<MenuItemView>> byCategory = menu.stream()
                .collect(Collectors.groupingBy(MenuItemView::category, LinkedHashMap::new, Collectors.toList()));

        StringBuilder sb = new StringBuilder("🍕 Our Menu:\n");
        byCategory.forEach((category, items) -> {
            sb.append('\n').append(label(category)).append(":\n");
            for (MenuItemView item : items) {
                sb.append("  • ").append(item.name()).append(" - ").append(prices(item)).append('\n');
            }
        });

        Map<String, Object> result = HandlerResults.success(sb.toString().trim());
        result.put(ResultKey.ITEMS, menu.stream().map(MenuItemView::name).toList());
        context.setHandlerResult(result);
        return context;
    }

    private String prices(MenuItemView item) {
        List<MenuSizeView> sizes = item.availableSizes();
        if (sizes.size() == 1) {
            return MoneyFormat.withCurrency(sizes.get(0).price());
        }
        return sizes.stream()
                .map(s -> s.size() + " " + MoneyFormat.amount(s.price()))
                .collect(Collectors.joining(" / ")) + " " + MoneyFormat.CURRENCY;
    }

    private String label(String category) {
        if (category == null || category.isEmpty()) {
            return "Other";
        }
        String lower = category.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
