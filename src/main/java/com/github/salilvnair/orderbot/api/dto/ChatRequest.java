package com.github.salilvnair.orderbot.api.dto;

import lombok.Data;

@Data
public class ChatRequest {
    private Long userId;
    private String message;
}
