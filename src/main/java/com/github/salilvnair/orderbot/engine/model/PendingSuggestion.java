package com.github.salilvnair.orderbot.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingSuggestion {
    private String actionType;
    private String item;
    private String size;
    private int quantity;
    private Instant createdAt;
}
