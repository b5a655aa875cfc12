package com.github.salilvnair.orderbot.engine.model;

public record BatchItem(String item, int quantity, String size) {

    public BatchItem {
        if (quantity < 1) {
            quantity = 1;
        }
    }
}
