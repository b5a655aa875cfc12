package com.github.salilvnair.orderbot.store.jpa;

import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.entity.ObCartItem;
import com.github.salilvnair.orderbot.entity.ObMenuItem;
import com.github.salilvnair.orderbot.entity.ObMenuSize;
import com.github.salilvnair.orderbot.entity.ObSessionState;
import com.github.salilvnair.orderbot.entity.ObUser;
import com.github.salilvnair.orderbot.repo.*;
import com.github.salilvnair.orderbot.store.model.CartMutation;
import com.github.salilvnair.orderbot.store.model.CheckoutResult;
import com.github.salilvnair.orderbot.store.model.MenuItemView;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JpaOrderingStoreTest {

    private final UserRepository users = mock(UserRepository.class);
    private final MenuItemRepository menuItems = mock(MenuItemRepository.class);
    private final MenuSizeRepository menuSizes = mock(MenuSizeRepository.class);
    private final CartItemRepository cartItems = mock(CartItemRepository.class);
    private final OrderRepository orders = mock(OrderRepository.class);
    private final OrderItemRepository orderItems = mock(OrderItemRepository.class);
    private final ConversationHistoryRepository history = mock(ConversationHistoryRepository.class);
    private final SessionStateRepository sessions = mock(SessionStateRepository.class);

    private final JpaOrderingStore store = new JpaOrderingStore(users, menuItems, menuSizes, cartItems, orders,
            orderItems, history, sessions, Clock.fixed(Instant.parse("2026-01-15T12:00:00Z"), ZoneOffset.UTC));

    private final ObMenuItem margherita = ObMenuItem.builder()
            .itemId(1L).name(MARGHERITA).category("pizza").available(true).build();
    private final ObMenuSize large = ObMenuSize.builder()
            .sizeId(3L).itemId(1L).sizeCode(SIZE_L).price(new BigDecimal("140")).available(true).build();

    @Test
    void addToCartIncrementsExistingRow() {
        when(menuSizes.findById(3L)).thenReturn(Optional.of(large));
        when(menuItems.findById(1L)).thenReturn(Optional.of(margherita));
        when(users.findById(USER_ID)).thenReturn(Optional.of(ObUser.builder().userId(USER_ID).name("Guest").build()));
        when(cartItems.findByUserIdAndSizeId(USER_ID, 3L)).thenReturn(Optional.of(
                ObCartItem.builder().cartItemId(9L).userId(USER_ID).sizeId(3L).quantity(1).build()));

        CartMutation mutation = store.addToCart(USER_ID, 3L, 2);

        assertTrue(mutation.success());
        assertEquals("Added Margherita Pizza (L) x 2 to cart", mutation.message());
        assertEquals(3, mutation.line().quantity());
        assertEquals(0, new BigDecimal("420").compareTo(mutation.line().subtotal()));
        ArgumentCaptor<ObCartItem> saved = ArgumentCaptor.forClass(ObCartItem.class);
        verify(cartItems).save(saved.capture());
        assertEquals(3, saved.getValue().getQuantity());
    }

    @Test
    void addToCartRejectsUnavailableSize() {
        large.setAvailable(false);
        when(menuSizes.findById(3L)).thenReturn(Optional.of(large));

        CartMutation mutation = store.addToCart(USER_ID, 3L, 1);

        assertFalse(mutation.success());
        assertEquals("That item is not available", mutation.message());
        verify(cartItems, never()).save(any());
    }

    @Test
    void addToCartRefusesToGrowLineBeyondLimit() {
        when(menuSizes.findById(3L)).thenReturn(Optional.of(large));
        when(menuItems.findById(1L)).thenReturn(Optional.of(margherita));
        when(users.findById(USER_ID)).thenReturn(Optional.of(ObUser.builder().userId(USER_ID).name("Guest").build()));
        when(cartItems.findByUserIdAndSizeId(USER_ID, 3L)).thenReturn(Optional.of(
                ObCartItem.builder().cartItemId(9L).userId(USER_ID).sizeId(3L).quantity(98).build()));

        CartMutation mutation = store.addToCart(USER_ID, 3L, 5);

        assertFalse(mutation.success());
        assertEquals("You can have at most 99 x Margherita Pizza (L) in your cart", mutation.message());
        verify(cartItems, never()).save(any());
    }

    @Test
    void addToCartRejectsOversizedQuantityBeforeLookup() {
        CartMutation mutation = store.addToCart(USER_ID, 3L, 2_000_000_000);

        assertFalse(mutation.success());
        assertEquals("Quantity must be at most 99", mutation.message());
        verify(menuSizes, never()).findById(any());
        verify(cartItems, never()).save(any());
    }

    @Test
    void unknownUserIsCreatedOnFirstContact() {
        when(users.findById(USER_ID)).thenReturn(Optional.empty());
        when(users.save(any(ObUser.class))).thenAnswer(inv -> inv.getArgument(0));

        assertEquals("Guest " + USER_ID, store.getUser(USER_ID).name());
        verify(users).save(any(ObUser.class));
    }

    @Test
    void checkoutOfEmptyCartFails() {
        when(cartItems.findByUserIdOrderByCartItemIdAsc(USER_ID)).thenReturn(List.of());

        CheckoutResult result = store.checkout(USER_ID);

        assertFalse(result.success());
        assertEquals("Cart is empty", result.message());
        verifyNoInteractions(orders);
    }

    @Test
    void fuzzyLookupFallsBackToContains() {
        when(menuItems.findFirstByNameIgnoreCase("pizza")).thenReturn(Optional.empty());
        when(menuItems.findByNameContainingIgnoreCaseOrderByItemIdAsc("pizza")).thenReturn(List.of(margherita));
        when(menuSizes.findByItemIdOrderBySizeIdAsc(1L)).thenReturn(List.of(large));

        MenuItemView item = store.getMenuItem("pizza", false).orElseThrow();

        assertEquals(MARGHERITA, item.name());
        assertEquals(List.of(SIZE_L), item.sizes().stream().map(s -> s.size()).toList());
        assertTrue(store.getMenuItem("pizza", true).isEmpty());
    }

    @Test
    void corruptSessionStateStartsEmpty() {
        when(sessions.findById(USER_ID)).thenReturn(Optional.of(
                ObSessionState.builder().userId(USER_ID).stateJson("{not json").build()));

        SessionState state = store.loadSessionState(USER_ID);

        assertNull(state.getPendingAction());
        assertNull(state.getPendingSuggestion());
    }
}
