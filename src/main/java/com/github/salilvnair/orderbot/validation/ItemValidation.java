package com.github.salilvnair.orderbot.validation;

import com.github.salilvnair.orderbot.store.model.MenuItemView;
import com.github.salilvnair.orderbot.store.model.MenuSizeView;

import java.util.List;

public record ItemValidation(
        Status status,
        String message,
        MenuItemView item,
        MenuSizeView size,
        List<String> similarItems
) {

    public enum Status {
        VALID,
        EMPTY_NAME,
        NOT_FOUND,
        SIMILAR_FOUND,
        OUT_OF_STOCK,
        NO_SIZES,
        SIZE_UNAVAILABLE,
        SIZE_NOT_OFFERED
    }

    public ItemValidation {
        similarItems = similarItems == null ? List.of() : List.copyOf(similarItems);
    }

    public static ItemValidation failed(Status status, String message) {
        return new ItemValidation(status, message, null, null, List.of());
    }

    public boolean valid() {
        return status == Status.VALID;
    }

    public String bestSuggestion() {
        return similarItems.isEmpty() ? null : similarItems.get(0);
    }
}
