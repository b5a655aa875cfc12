package com.github.salilvnair.orderbot.store.model;

import java.math.BigDecimal;
import java.util.List;

public record CheckoutResult(
        boolean success,
        String message,
        Long orderId,
        BigDecimal totalPrice,
        List<CartLine> items
) {

    public CheckoutResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CheckoutResult failed(String message) {
        return new CheckoutResult(false, message, null, BigDecimal.ZERO, List.of());
    }
}
