package com.github.salilvnair.orderbot.store.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record OrderView(
        Long orderId,
        Long userId,
        String status,
        BigDecimal totalPrice,
        List<CartLine> items,
        Instant createdAt
) {}
