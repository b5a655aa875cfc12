package com.github.salilvnair.orderbot.store.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CartSnapshot(List<CartLine> items, BigDecimal totalPrice, int itemCount) {

    public CartSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
        totalPrice = totalPrice == null ? BigDecimal.ZERO : totalPrice;
    }

    public static CartSnapshot empty() {
        return new CartSnapshot(List.of(), BigDecimal.ZERO, 0);
    }

    public static CartSnapshot of(List<CartLine> items) {
        BigDecimal total = items.stream()
                .map(CartLine::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new CartSnapshot(items, total, items.size());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean containsCategory(String category) {
        return items.stream().anyMatch(l -> category.equalsIgnoreCase(l.category()));
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("items", items.stream().map(CartLine::toMap).toList());
        map.put("total_price", totalPrice);
        map.put("item_count", itemCount);
        return map;
    }
}
