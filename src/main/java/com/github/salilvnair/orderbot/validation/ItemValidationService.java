package com.github.salilvnair.orderbot.validation;

import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.MenuItemView;
import com.github.salilvnair.orderbot.store.model.MenuSizeView;
import com.github.salilvnair.orderbot.util.MoneyFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks an item request against the menu before it reaches the cart:
 * existence, availability and size.
 */
@Service
@RequiredArgsConstructor
public class ItemValidationService {

    private static final int MAX_SIMILAR = 3;

    private final OrderingStore store;

    public ItemValidation validateItem(String itemName) {
        if (itemName == null || itemName.isBlank()) {
            return ItemValidation.failed(ItemValidation.Status.EMPTY_NAME, "Item name cannot be empty");
        }
        Optional<MenuItemView> found = store.getMenuItem(itemName, false);
        if (found.isEmpty()) {
            List<String> similar = store.searchMenu(itemName).stream()
                    .map(MenuItemView::name)
                    .limit(MAX_SIMILAR)
                    .toList();
            if (!similar.isEmpty()) {
                return new ItemValidation(
                        ItemValidation.Status.SIMILAR_FOUND,
                        "'" + itemName + "' not found. Did you mean: " + String.join(", ", similar) + "?",
                        null,
                        null,
                        similar
                );
            }
            return ItemValidation.failed(ItemValidation.Status.NOT_FOUND, "'" + itemName + "' not found in menu");
        }
        MenuItemView item = found.get();
        if (!item.available()) {
            return new ItemValidation(ItemValidation.Status.OUT_OF_STOCK,
                    item.name() + " is currently out of stock", item, null, List.of());
        }
        return new ItemValidation(ItemValidation.Status.VALID, "Item '" + item.name() + "' found", item, null, List.of());
    }

    /**
     * Full check of item and size. Without a size the first available size is used.
     */
    public ItemValidation validateFullItem(String itemName, String size) {
        ItemValidation itemCheck = validateItem(itemName);
        if (!itemCheck.valid()) {
            return itemCheck;
        }
        MenuItemView item = itemCheck.item();

        if (size == null || size.isBlank()) {
            List<MenuSizeView> available = item.availableSizes();
            if (available.isEmpty()) {
                return new ItemValidation(ItemValidation.Status.NO_SIZES,
                        item.name() + " has no available sizes", item, null, List.of());
            }
            return valid(item, available.get(0));
        }

        Optional<MenuSizeView> requested = item.findSize(size);
        if (requested.isEmpty()) {
            String offered = item.sizes().stream().map(MenuSizeView::size).collect(Collectors.joining(", "));
            return new ItemValidation(ItemValidation.Status.SIZE_NOT_OFFERED,
                    "Size " + size + " not available. Try: " + offered, item, null, List.of());
        }
        if (!requested.get().available()) {
            return new ItemValidation(ItemValidation.Status.SIZE_UNAVAILABLE,
                    size + " size for " + item.name() + " is currently unavailable", item, null, List.of());
        }
        return valid(item, requested.get());
    }

    public String availableSizesText(MenuItemView item) {
        if (item == null) {
            return null;
        }
        List<MenuSizeView> sizes = item.availableSizes();
        if (sizes.isEmpty()) {
            return "No sizes available";
        }
        return sizes.stream()
                .map(s -> s.size() + " (" + MoneyFormat.withCurrency(s.price()) + ")")
                .collect(Collectors.joining(", "));
    }

    private ItemValidation valid(MenuItemView item, MenuSizeView size) {
        return new ItemValidation(ItemValidation.Status.VALID,
                item.name() + " (" + size.size() + ") is available", item, size, List.of());
    }
}
