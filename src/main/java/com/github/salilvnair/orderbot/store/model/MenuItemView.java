package com.github.salilvnair.orderbot.store.model;

import java.util.List;
import java.util.Optional;

public record MenuItemView(
        Long id,
        String name,
        String category,
        boolean available,
        List<MenuSizeView> sizes
) {

    public MenuItemView {
        sizes = sizes == null ? List.of() : List.copyOf(sizes);
    }

    public List<MenuSizeView> availableSizes() {
        return sizes.stream().filter(MenuSizeView::available).toList();
    }

    public Optional<MenuSizeView> findSize(String sizeCode) {
        if (sizeCode == null) {
            return Optional.empty();
        }
        return sizes.stream().filter(s -> s.size().equalsIgnoreCase(sizeCode.trim())).findFirst();
    }
}
