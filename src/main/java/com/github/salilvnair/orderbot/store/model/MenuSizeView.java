package com.github.salilvnair.orderbot.store.model;

import java.math.BigDecimal;

public record MenuSizeView(Long id, String size, BigDecimal price, boolean available) {}
