package com.github.salilvnair.orderbot.store.jpa;

import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.model.ConversationTurn;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.entity.*;
import com.github.salilvnair.orderbot.repo.*;
import com.github.salilvnair.orderbot.store.CartLimits;
import com.github.salilvnair.orderbot.store.MenuSearch;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.*;
import com.github.salilvnair.orderbot.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link OrderingStore} over Spring Data JPA repositories.
 */
@Slf4j
@Component
@Transactional
@RequiredArgsConstructor
public class JpaOrderingStore implements OrderingStore {

    static final String STATUS_CONFIRMED = "confirmed";
    private static final int FAVORITES = 3;

    private final UserRepository userRepository;
    private final MenuItemRepository menuItemRepository;
    private final MenuSizeRepository menuSizeRepository;
    private final CartItemRepository cartItemRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final ConversationHistoryRepository historyRepository;
    private final SessionStateRepository sessionStateRepository;
    private final Clock clock;

    @Override
    public UserProfile getUser(Long userId) {
        ObUser user = userRepository.findById(userId).orElseGet(() -> {
            log.info("Creating user on first contact userId={}", userId);
            return userRepository.save(ObUser.builder()
                    .userId(userId)
                    .name("Guest " + userId)
                    .createdAt(now())
                    .build());
        });
        List<OrderView> orders = getOrders(userId);
        Map<String, Integer> counts = new HashMap<>();
        orders.forEach(o -> o.items().forEach(l -> counts.merge(l.itemName(), l.quantity(), Integer::sum)));
        List<String> favorites = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(FAVORITES)
                .map(Map.Entry::getKey)
                .toList();
        return new UserProfile(user.getUserId(), user.getName(), orders.size(), favorites);
    }

    @Override
    @Transactional(readOnly = true)
    public CartSnapshot getCart(Long userId) {
        List<ObCartItem> rows = cartItemRepository.findByUserIdOrderByCartItemIdAsc(userId);
        if (rows.isEmpty()) {
            return CartSnapshot.empty();
        }
        Map<Long, ObMenuSize> sizes = menuSizeRepository.findAllById(
                        rows.stream().map(ObCartItem::getSizeId).toList()).stream()
                .collect(Collectors.toMap(ObMenuSize::getSizeId, Function.identity()));
        Map<Long, ObMenuItem> items = menuItemRepository.findAllById(
                        sizes.values().stream().map(ObMenuSize::getItemId).distinct().toList()).stream()
                .collect(Collectors.toMap(ObMenuItem::getItemId, Function.identity()));

        List<CartLine> lines = new ArrayList<>();
        for (ObCartItem row : rows) {
            ObMenuSize size = sizes.get(row.getSizeId());
            if (size == null) {
                log.warn("Dropping cart row {} pointing at missing size {}", row.getCartItemId(), row.getSizeId());
                continue;
            }
            lines.add(toLine(items.get(size.getItemId()), size, row.getQuantity()));
        }
        return CartSnapshot.of(lines);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationTurn> getHistory(Long userId, int limit) {
        List<ObConversationHistory> latest = new ArrayList<>(historyRepository
                .findByUserIdOrderByHistoryIdDesc(userId, PageRequest.of(0, Math.max(1, limit)))
                .getContent());
        Collections.reverse(latest);
        return latest.stream()
                .map(h -> new ConversationTurn(h.getRole(), h.getContentText(),
                        h.getMetadata() == null ? Map.of() : h.getMetadata(),
                        h.getCreatedAt().toInstant()))
                .toList();
    }

    @Override
    public void appendHistory(Long userId, String role, String text, Map<String, Object> metadata) {
        historyRepository.save(ObConversationHistory.builder()
                .userId(userId)
                .role(role)
                .contentText(text)
                .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                .createdAt(now())
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MenuItemView> getMenuItem(String nameQuery, boolean exact) {
        if (nameQuery == null || nameQuery.isBlank()) {
            return Optional.empty();
        }
        String query = nameQuery.trim();
        Optional<ObMenuItem> found = menuItemRepository.findFirstByNameIgnoreCase(query);
        if (found.isEmpty() && !exact) {
            found = menuItemRepository.findByNameContainingIgnoreCaseOrderByItemIdAsc(query).stream().findFirst();
        }
        return found.map(item -> toView(item, menuSizeRepository.findByItemIdOrderBySizeIdAsc(item.getItemId())));
    }

    @Override
    @Transactional(readOnly = true)
    public List<MenuItemView> searchMenu(String query) {
        List<String> words = MenuSearch.searchWords(query);
        if (words.isEmpty()) {
            return List.of();
        }
        return listMenu().stream()
                .filter(item -> MenuSearch.sharesWord(item.name(), words))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MenuItemView> listMenu() {
        List<ObMenuItem> items = menuItemRepository.findAllByOrderByItemIdAsc();
        Map<Long, List<ObMenuSize>> sizes = menuSizeRepository
                .findByItemIdInOrderBySizeIdAsc(items.stream().map(ObMenuItem::getItemId).toList()).stream()
                .collect(Collectors.groupingBy(ObMenuSize::getItemId, LinkedHashMap::new, Collectors.toList()));
        return items.stream()
                .map(item -> toView(item, sizes.getOrDefault(item.getItemId(), List.of())))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<MenuSizeView> getAvailableSizes(Long itemId) {
        return menuSizeRepository.findByItemIdOrderBySizeIdAsc(itemId).stream()
                .filter(ObMenuSize::isAvailable)
                .map(this::toSizeView)
                .toList();
    }

    @Override
    public CartMutation addToCart(Long userId, Long menuSizeId, int quantity) {
        String rejection = CartLimits.rejectionFor(quantity);
        if (rejection != null) {
            return CartMutation.failed(rejection);
        }
        Optional<ObMenuSize> size = menuSizeRepository.findById(menuSizeId);
        if (size.isEmpty() || !size.get().isAvailable()) {
            return CartMutation.failed("That item is not available");
        }
        ObMenuItem item = menuItemRepository.findById(size.get().getItemId()).orElse(null);
        if (item == null || !item.isAvailable()) {
            return CartMutation.failed("That item is not available");
        }
        getUser(userId);

        ObCartItem row = cartItemRepository.findByUserIdAndSizeId(userId, menuSizeId)
                .orElseGet(() -> ObCartItem.builder()
                        .userId(userId)
                        .sizeId(menuSizeId)
                        .quantity(0)
                        .addedAt(now())
                        .build());
        OptionalInt merged = CartLimits.merge(row.getQuantity(), quantity);
        if (merged.isEmpty()) {
            return CartMutation.failed(CartLimits.lineFull(item.getName(), size.get().getSizeCode()));
        }
        row.setQuantity(merged.getAsInt());
        cartItemRepository.save(row);

        CartLine line = toLine(item, size.get(), row.getQuantity());
        return new CartMutation(true,
                "Added " + item.getName() + " (" + size.get().getSizeCode() + ") x " + quantity + " to cart", line);
    }

    @Override
    public CartMutation removeFromCart(Long userId, Long menuSizeId) {
        Optional<ObCartItem> row = cartItemRepository.findByUserIdAndSizeId(userId, menuSizeId);
        if (row.isEmpty()) {
            return CartMutation.failed("Item not in cart");
        }
        CartLine line = lineFor(menuSizeId, row.get().getQuantity());
        cartItemRepository.delete(row.get());
        return new CartMutation(true, "Removed " + line.itemName() + " (" + line.size() + ") from cart", line);
    }

    @Override
    public CartMutation updateQuantity(Long userId, Long menuSizeId, int quantity) {
        if (quantity <= 0) {
            return removeFromCart(userId, menuSizeId);
        }
        if (quantity > CartLimits.MAX_LINE_QUANTITY) {
            return CartMutation.failed(CartLimits.rejectionFor(quantity));
        }
        Optional<ObCartItem> row = cartItemRepository.findByUserIdAndSizeId(userId, menuSizeId);
        if (row.isEmpty()) {
            return CartMutation.failed("Item not in cart");
        }
        row.get().setQuantity(quantity);
        cartItemRepository.save(row.get());
        CartLine line = lineFor(menuSizeId, quantity);
        return new CartMutation(true,
                "Updated " + line.itemName() + " (" + line.size() + ") quantity to " + quantity, line);
    }

    @Override
    public void clearCart(Long userId) {
        cartItemRepository.deleteByUserId(userId);
    }

    @Override
    public CheckoutResult checkout(Long userId) {
        CartSnapshot cart = getCart(userId);
        if (cart.isEmpty()) {
            return CheckoutResult.failed("Cart is empty");
        }
        ObOrder order = orderRepository.save(ObOrder.builder()
                .userId(userId)
                .status(STATUS_CONFIRMED)
                .totalPrice(cart.totalPrice())
                .createdAt(now())
                .build());
        for (CartLine line : cart.items()) {
            orderItemRepository.save(ObOrderItem.builder()
                    .orderId(order.getOrderId())
                    .sizeId(line.menuSizeId())
                    .itemName(line.itemName())
                    .category(line.category())
                    .sizeCode(line.size())
                    .unitPrice(line.price())
                    .quantity(line.quantity())
                    .subtotal(line.subtotal())
                    .build());
        }
        cartItemRepository.deleteByUserId(userId);
        return new CheckoutResult(true, "Order #" + order.getOrderId() + " placed successfully",
                order.getOrderId(), cart.totalPrice(), cart.items());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderView> getOrder(Long orderId) {
        return orderRepository.findById(orderId).map(this::toOrderView);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderView> getOrders(Long userId) {
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(this::toOrderView)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> popularItemNames(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return orderItemRepository.findPopularItemNames(PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public SessionState loadSessionState(Long userId) {
        Optional<ObSessionState> row = sessionStateRepository.findById(userId);
        if (row.isEmpty() || row.get().getStateJson() == null || row.get().getStateJson().isBlank()) {
            return new SessionState();
        }
        try {
            return JsonUtil.fromJson(row.get().getStateJson(), SessionState.class);
        } catch (IllegalStateException e) {
            log.warn("{} for userId={}, starting from an empty session: {}",
                    DialogueEngineErrorCode.SESSION_STATE_CORRUPT.defaultMessage(), userId, e.getMessage());
            return new SessionState();
        }
    }

    @Override
    public void saveSessionState(Long userId, SessionState state) {
        ObSessionState row = sessionStateRepository.findById(userId)
                .orElseGet(() -> ObSessionState.builder().userId(userId).build());
        row.setStateJson(JsonUtil.toJson(state == null ? new SessionState() : state));
        sessionStateRepository.save(row);
    }

    private OrderView toOrderView(ObOrder order) {
        List<CartLine> lines = orderItemRepository.findByOrderIdOrderByOrderItemIdAsc(order.getOrderId()).stream()
                .map(i -> new CartLine(i.getSizeId(), i.getItemName(), i.getCategory(), i.getSizeCode(),
                        i.getUnitPrice(), i.getQuantity(), i.getSubtotal()))
                .toList();
        return new OrderView(order.getOrderId(), order.getUserId(), order.getStatus(), order.getTotalPrice(),
                lines, order.getCreatedAt().toInstant());
    }

    private CartLine lineFor(Long menuSizeId, int quantity) {
        ObMenuSize size = menuSizeRepository.findById(menuSizeId).orElseThrow();
        ObMenuItem item = menuItemRepository.findById(size.getItemId()).orElseThrow();
        return toLine(item, size, quantity);
    }

    private CartLine toLine(ObMenuItem item, ObMenuSize size, int quantity) {
        String name = item == null ? "Unknown item" : item.getName();
        String category = item == null ? null : item.getCategory();
        BigDecimal subtotal = size.getPrice().multiply(BigDecimal.valueOf(quantity));
        return new CartLine(size.getSizeId(), name, category, size.getSizeCode(), size.getPrice(), quantity, subtotal);
    }

    private MenuItemView toView(ObMenuItem item, List<ObMenuSize> sizes) {
        return new MenuItemView(item.getItemId(), item.getName(), item.getCategory(), item.isAvailable(),
                sizes.stream().map(this::toSizeView).toList());
    }

    private MenuSizeView toSizeView(ObMenuSize size) {
        return new MenuSizeView(size.getSizeId(), size.getSizeCode(), size.getPrice(), size.isAvailable());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
