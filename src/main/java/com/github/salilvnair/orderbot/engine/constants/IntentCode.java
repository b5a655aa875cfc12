package com.github.salilvnair.orderbot.engine.constants;

import java.util.Set;

public final class IntentCode {

    private IntentCode() {
    }

    public static final String WELCOME = "welcome";
    public static final String TRACK_ORDER = "track_order";
    public static final String ADD_ITEM = "add_item";
    public static final String BATCH_ADD_ITEM = "batch_add_item";
    public static final String REMOVE_ITEM = "remove_item";
    public static final String VIEW_CART = "view_cart";
    public static final String CLEAR_CART = "clear_cart";
    public static final String CHECKOUT = "checkout";
    public static final String BROWSE_MENU = "browse_menu";
    public static final String NEW_ORDER = "new_order";
    public static final String CONFIRMATION = "confirmation";
    public static final String REJECTION = "rejection";
    public static final String MODIFY_ORDER = "modify_order";
    public static final String UNKNOWN = "unknown";

    /** Intents whose handlers change the cart; the cart snapshot is reloaded after them. */
    public static final Set<String> CART_MUTATING = Set.of(
            ADD_ITEM, BATCH_ADD_ITEM, REMOVE_ITEM, CLEAR_CART, CHECKOUT, CONFIRMATION
    );
}
