package com.github.salilvnair.orderbot.recommendation;

import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.store.MenuCatalog;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.*;
import com.github.salilvnair.orderbot.util.MoneyFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Complementary items for what is in the cart first, then items similar to the user's
 * favourites, then popular or featured items. Never recommends something already in the cart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultRecommendationProvider implements RecommendationProvider {

    private final OrderingStore store;

    @Override
    public List<Recommendation> getRecommendations(Long userId, CartSnapshot cart, int maxItems) {
        if (maxItems <= 0) {
            return List.of();
        }
        List<MenuItemView> menu = store.listMenu().stream().filter(MenuItemView::available).toList();
        Set<String> excluded = new HashSet<>();
        if (cart != null) {
            cart.items().forEach(l -> excluded.add(l.itemName().toLowerCase(Locale.ROOT)));
        }

        List<Recommendation> picks = new ArrayList<>();
        complementary(cart, menu, excluded, picks, maxItems);
        if (picks.size() < maxItems) {
            personalized(userId, menu, excluded, picks, maxItems);
        }
        if (picks.size() < maxItems) {
            popular(menu, excluded, picks, maxItems);
        }
        if (picks.size() < maxItems) {
            featured(menu, excluded, picks, maxItems);
        }
        return picks;
    }

    @Override
    public String formatRecommendationsText(List<Recommendation> recommendations, String language) {
        if (recommendations == null || recommendations.isEmpty()) {
            return "";
        }
        boolean ar = LanguageCode.isArabic(language);
        String currency = ar ? "جنيه" : MoneyFormat.CURRENCY;
        StringBuilder sb = new StringBuilder(ar ? "🎯 اقتراحات ليك:\n\n" : "🎯 Recommendations for you:\n\n");
        for (Recommendation rec : recommendations) {
            sb.append(rec.badge() == null ? "⭐" : rec.badge()).append(' ').append(rec.name()).append('\n');
            if (rec.reason() != null) {
                sb.append("   ").append(rec.reason()).append('\n');
            }
            List<MenuSizeView> sizes = rec.sizes();
            if (sizes.size() == 1) {
                sb.append("   ").append(MoneyFormat.amount(sizes.get(0).price())).append(' ').append(currency).append('\n');
            } else if (!sizes.isEmpty()) {
                sb.append("   ").append(sizes.stream()
                        .map(s -> s.size() + "(" + MoneyFormat.amount(s.price()) + " " + currency + ")")
                        .collect(Collectors.joining(", "))).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void complementary(CartSnapshot cart, List<MenuItemView> menu, Set<String> excluded,
                               List<Recommendation> picks, int maxItems) {
        if (cart == null || cart.isEmpty() || !cart.containsCategory(MenuCatalog.PIZZA)) {
            return;
        }
        boolean hasDrink = cart.items().stream().anyMatch(l -> isDrink(l.itemName()));
        boolean hasSide = cart.items().stream().anyMatch(l -> nameContains(l.itemName(), "fries"));

        if (!hasDrink) {
            menu.stream()
                    .filter(i -> MenuCatalog.ADDITION.equalsIgnoreCase(i.category()) && isDrink(i.name()))
                    .limit(2)
                    .forEach(i -> add(picks, excluded, maxItems, i, "Perfect with your pizza!", "🥤 Pair it"));
        }
        if (!hasSide) {
            menu.stream()
                    .filter(i -> MenuCatalog.ADDITION.equalsIgnoreCase(i.category()) && nameContains(i.name(), "fries"))
                    .findFirst()
                    .ifPresent(i -> add(picks, excluded, maxItems, i, "Complete your meal!", "🍟 Add on"));
        }
    }

    private void personalized(Long userId, List<MenuItemView> menu, Set<String> excluded,
                              List<Recommendation> picks, int maxItems) {
        List<OrderView> orders = store.getOrders(userId);
        if (orders.isEmpty()) {
            return;
        }
        Map<String, Integer> counts = new HashMap<>();
        for (OrderView order : orders) {
            for (CartLine line : order.items()) {
                counts.merge(line.itemName(), line.quantity(), Integer::sum);
            }
        }
        Optional<String> favourite = counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey);
        if (favourite.isEmpty()) {
            return;
        }
        Map<String, MenuItemView> byName = menu.stream()
                .collect(Collectors.toMap(i -> i.name().toLowerCase(Locale.ROOT), Function.identity(), (a, b) -> a));
        MenuItemView favouriteItem = byName.get(favourite.get().toLowerCase(Locale.ROOT));
        if (favouriteItem == null) {
            return;
        }
        menu.stream()
                .filter(i -> i.category().equalsIgnoreCase(favouriteItem.category()))
                .filter(i -> !i.name().equalsIgnoreCase(favouriteItem.name()))
                .forEach(i -> add(picks, excluded, maxItems, i,
                        "Similar to your favorite " + favouriteItem.name(), "✨ For You"));
    }

    private void popular(List<MenuItemView> menu, Set<String> excluded, List<Recommendation> picks, int maxItems) {
        Map<String, MenuItemView> byName = menu.stream()
                .collect(Collectors.toMap(i -> i.name().toLowerCase(Locale.ROOT), Function.identity(), (a, b) -> a));
        for (String name : store.popularItemNames(maxItems + excluded.size())) {
            MenuItemView item = byName.get(name.toLowerCase(Locale.ROOT));
            if (item != null) {
                add(picks, excluded, maxItems, item, "Popular choice", "🔥 Popular");
            }
        }
    }

    private void featured(List<MenuItemView> menu, Set<String> excluded, List<Recommendation> picks, int maxItems) {
        menu.forEach(i -> add(picks, excluded, maxItems, i, "Great choice", "⭐ Featured"));
    }

    private void add(List<Recommendation> picks, Set<String> excluded, int maxItems,
                     MenuItemView item, String reason, String badge) {
        if (picks.size() >= maxItems) {
            return;
        }
        String key = item.name().toLowerCase(Locale.ROOT);
        if (!excluded.add(key)) {
            return;
        }
        picks.add(new Recommendation(item.id(), item.name(), item.category(), item.availableSizes(), reason, badge));
    }

    private boolean isDrink(String name) {
        return nameContains(name, "cola") || nameContains(name, "juice");
    }

    private boolean nameContains(String name, String token) {
        return name != null && name.toLowerCase(Locale.ROOT).contains(token);
    }
}
