package com.github.salilvnair.orderbot.store.model;

public record CartMutation(boolean success, String message, CartLine line) {

    public static CartMutation failed(String message) {
        return new CartMutation(false, message, null);
    }
}
