package com.github.salilvnair.orderbot.store;

import com.github.salilvnair.orderbot.engine.model.ConversationTurn;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.store.model.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * User, cart, menu, order and dialogue-session storage used by the dialogue engine.
 * Domain failures (unknown menu size, empty cart) are reported through result values.
 */
public interface OrderingStore {

    /** Returns the user, creating it on first contact. */
    UserProfile getUser(Long userId);

    CartSnapshot getCart(Long userId);

    /** Last {@code limit} turns, oldest first. */
    List<ConversationTurn> getHistory(Long userId, int limit);

    void appendHistory(Long userId, String role, String text, Map<String, Object> metadata);

    /**
     * Case-insensitive lookup. With {@code exact} the whole name must match, otherwise the
     * first item whose name contains the query.
     */
    Optional<MenuItemView> getMenuItem(String nameQuery, boolean exact);

    /** Items sharing at least one meaningful word with the query. */
    List<MenuItemView> searchMenu(String query);

    List<MenuItemView> listMenu();

    List<MenuSizeView> getAvailableSizes(Long itemId);

    CartMutation addToCart(Long userId, Long menuSizeId, int quantity);

    CartMutation removeFromCart(Long userId, Long menuSizeId);

    CartMutation updateQuantity(Long userId, Long menuSizeId, int quantity);

    void clearCart(Long userId);

    CheckoutResult checkout(Long userId);

    Optional<OrderView> getOrder(Long orderId);

    List<OrderView> getOrders(Long userId);

    /** Item names ordered most often across all users, most popular first. */
    List<String> popularItemNames(int limit);

    SessionState loadSessionState(Long userId);

    void saveSessionState(Long userId, SessionState state);
}
