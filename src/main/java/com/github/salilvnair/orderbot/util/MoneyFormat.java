package com.github.salilvnair.orderbot.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;

@UtilityClass
public final class MoneyFormat {

    public static final String CURRENCY = "EGP";

    public static String amount(BigDecimal value) {
        if (value == null) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public static String withCurrency(BigDecimal value) {
        return amount(value) + " " + CURRENCY;
    }
}
