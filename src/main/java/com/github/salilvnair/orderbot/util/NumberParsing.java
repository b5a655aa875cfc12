package com.github.salilvnair.orderbot.util;

import lombok.experimental.UtilityClass;

/**
 * Integer reading for numbers typed by users. Values beyond the {@code int} range saturate
 * instead of failing, so an absurd quantity stays a number the cart can reject.
 */
@UtilityClass
public final class NumberParsing {

    private static final int MAX_INT_DIGITS = 10;

    /** Non-negative digit run, e.g. a regex {@code \d+} capture. */
    public static int saturatedInt(String digits) {
        String trimmed = digits.trim();
        int firstSignificant = 0;
        while (firstSignificant < trimmed.length() - 1
                && Character.digit(trimmed.charAt(firstSignificant), 10) == 0) {
            firstSignificant++;
        }
        String significant = trimmed.substring(firstSignificant);
        if (significant.length() > MAX_INT_DIGITS) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Long.parseLong(significant), Integer.MAX_VALUE);
    }

    public static int saturatedInt(Number number) {
        if (number.doubleValue() >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (number.doubleValue() <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return number.intValue();
    }
}
