package com.github.salilvnair.orderbot.recommendation;

import com.github.salilvnair.orderbot.store.model.MenuSizeView;

import java.util.List;

public record Recommendation(
        Long menuItemId,
        String name,
        String category,
        List<MenuSizeView> sizes,
        String reason,
        String badge
) {

    public Recommendation {
        sizes = sizes == null ? List.of() : List.copyOf(sizes);
    }
}
