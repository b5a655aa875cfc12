package com.github.salilvnair.orderbot.store;

import lombok.experimental.UtilityClass;

import java.util.OptionalInt;

/**
 * Quantity bounds shared by {@link OrderingStore} implementations. A cart line holds at most
 * {@link #MAX_LINE_QUANTITY} units.
 */
@UtilityClass
public final class CartLimits {

    public static final int MAX_LINE_QUANTITY = 99;

    /** Reason a requested quantity is refused, or null when it is acceptable. */
    public static String rejectionFor(int quantity) {
        if (quantity < 1) {
            return "Quantity must be at least 1";
        }
        if (quantity > MAX_LINE_QUANTITY) {
            return "Quantity must be at most " + MAX_LINE_QUANTITY;
        }
        return null;
    }

    /** Line quantity after adding {@code added}; empty when the line would exceed the limit. */
    public static OptionalInt merge(int current, int added) {
        int total;
        try {
            total = Math.addExact(current, added);
        } catch (ArithmeticException e) {
            return OptionalInt.empty();
        }
        return total > MAX_LINE_QUANTITY ? OptionalInt.empty() : OptionalInt.of(total);
    }

    public static String lineFull(String itemName, String size) {
        return "You can have at most " + MAX_LINE_QUANTITY + " x " + itemName + " (" + size + ") in your cart";
    }
}
