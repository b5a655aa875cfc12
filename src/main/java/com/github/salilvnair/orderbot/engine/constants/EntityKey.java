package com.github.salilvnair.orderbot.engine.constants;

import java.util.List;

public final class EntityKey {

    private EntityKey() {
    }

    public static final String ITEM = "item";
    public static final String SIZE = "size";
    public static final String QUANTITY = "quantity";
    public static final String ORDER_ID = "order_id";
    public static final String ADDRESS = "address";
    public static final String PHONE = "phone";
    public static final String ACTION = "action";

    public static final List<String> VOCABULARY = List.of(ITEM, SIZE, QUANTITY, ORDER_ID, ADDRESS, PHONE);
}
