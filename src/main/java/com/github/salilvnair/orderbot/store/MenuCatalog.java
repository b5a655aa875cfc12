package com.github.salilvnair.orderbot.store;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The standard menu seeded into an empty store.
 */
@UtilityClass
public final class MenuCatalog {

    public static final String PIZZA = "pizza";
    public static final String ADDITION = "addition";

    public record Entry(String name, String category, Map<String, BigDecimal> prices) {}

    public static final List<Entry> STANDARD = List.of(
            pizza("Margherita Pizza", 83, 100, 140),
            pizza("Vegetables Pizza", 85, 105, 145),
            pizza("Mushroom Pizza", 90, 120, 160),
            pizza("Cheese Lovers Pizza", 100, 125, 170),
            pizza("Hot Dog Pizza", 100, 125, 170),
            pizza("Salami Pizza", 105, 135, 180),
            pizza("Pastrami Pizza", 105, 135, 180),
            pizza("Double Pepperoni Pizza", 110, 145, 195),
            pizza("Super Supreme Pizza", 125, 165, 215),
            addition("Fries", 50),
            addition("Mango Juice", 40),
            addition("Cola", 20),
            addition("Water", 10)
    );

    private static Entry pizza(String name, int small, int medium, int large) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        prices.put("S", BigDecimal.valueOf(small));
        prices.put("M", BigDecimal.valueOf(medium));
        prices.put("L", BigDecimal.valueOf(large));
        return new Entry(name, PIZZA, prices);
    }

    private static Entry addition(String name, int regular) {
        return new Entry(name, ADDITION, Map.of("REG", BigDecimal.valueOf(regular)));
    }
}
