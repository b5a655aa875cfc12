package com.github.salilvnair.orderbot.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DialogueState {
    IDLE("idle"),
    AWAITING_SIZE("awaiting_size"),
    AWAITING_QUANTITY("awaiting_quantity"),
    AWAITING_CONFIRMATION("awaiting_confirmation"),
    AWAITING_ADDRESS("awaiting_address"),
    AWAITING_PAYMENT("awaiting_payment"),
    CLARIFYING_ITEM("clarifying_item");

    private final String value;

    DialogueState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** State to wait in while the given field is still missing. */
    public static DialogueState awaiting(String missingField) {
        if (missingField == null) {
            return IDLE;
        }
        return switch (missingField) {
            case "size" -> AWAITING_SIZE;
            case "quantity" -> AWAITING_QUANTITY;
            case "address" -> AWAITING_ADDRESS;
            default -> CLARIFYING_ITEM;
        };
    }
}
