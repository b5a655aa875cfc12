package com.github.salilvnair.orderbot.store.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public record CartLine(
        Long menuSizeId,
        String itemName,
        String category,
        String size,
        BigDecimal price,
        int quantity,
        BigDecimal subtotal
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("menu_size_id", menuSizeId);
        map.put("name", itemName);
        map.put("category", category);
        map.put("size", size);
        map.put("price", price);
        map.put("quantity", quantity);
        map.put("subtotal", subtotal);
        return map;
    }
}
