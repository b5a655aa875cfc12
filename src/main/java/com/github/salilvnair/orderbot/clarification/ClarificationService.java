package com.github.salilvnair.orderbot.clarification;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.model.DialogueState;
import com.github.salilvnair.orderbot.engine.model.PendingAction;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.store.OrderingStore;
import com.github.salilvnair.orderbot.store.model.CartLine;
import com.github.salilvnair.orderbot.store.model.CartSnapshot;
import com.github.salilvnair.orderbot.store.model.MenuItemView;
import com.github.salilvnair.orderbot.store.model.MenuSizeView;
import com.github.salilvnair.orderbot.util.MoneyFormat;
import com.github.salilvnair.orderbot.util.NumberParsing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether an intent with its entities can be acted on, asks for what is missing and
 * tracks the one incomplete action a user may have outstanding.
 */
@Service
@RequiredArgsConstructor
public class ClarificationService {

    /** Items that come in a single size; only the name is needed to add them. */
    static final List<String> SIMPLE_ADDITIONS = List.of("fries", "cola", "juice", "water", "drink");

    private static final Map<String, String> SIZE_NAMES_EN = Map.of(
            "S", "Small", "M", "Medium", "L", "Large", "REG", "Regular");
    private static final Map<String, String> SIZE_NAMES_AR = Map.of(
            "S", "صغير", "M", "متوسط", "L", "كبير", "REG", "عادي");

    private static final Map<String, List<String>> SIZE_WORDS = sizeWords();
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[\\s,.!?]+");

    private final OrderingStore store;
    private final Clock clock;

    public List<String> requiredFields(String intent, Map<String, Object> entities) {
        if (intent == null) {
            return List.of();
        }
        return switch (intent) {
            case IntentCode.ADD_ITEM -> {
                String item = text(entities, EntityKey.ITEM);
                if (item != null && isSimpleAddition(item)) {
                    yield List.of(EntityKey.ITEM);
                }
                yield List.of(EntityKey.ITEM, EntityKey.SIZE);
            }
            case IntentCode.REMOVE_ITEM -> List.of(EntityKey.ITEM);
            case IntentCode.TRACK_ORDER -> List.of(EntityKey.ORDER_ID);
            case IntentCode.MODIFY_ORDER -> List.of(EntityKey.ORDER_ID, EntityKey.ACTION);
            default -> List.of();
        };
    }

    public ClarificationCheck needsClarification(String intent, Map<String, Object> entities) {
        List<String> missing = requiredFields(intent, entities).stream()
                .filter(field -> text(entities, field) == null)
                .toList();
        return missing.isEmpty() ? ClarificationCheck.none() : new ClarificationCheck(true, missing);
    }

    public String generateQuestion(
            String intent,
            Map<String, Object> entities,
            List<String> missing,
            String language,
            CartSnapshot cart
    ) {
        boolean ar = LanguageCode.isArabic(language);
        if (IntentCode.ADD_ITEM.equals(intent)) {
            return clarifyAddItem(entities, missing, ar);
        }
        if (IntentCode.REMOVE_ITEM.equals(intent)) {
            return clarifyRemoveItem(missing, ar, cart);
        }
        if (IntentCode.TRACK_ORDER.equals(intent) && missing.contains(EntityKey.ORDER_ID)) {
            return ar
                    ? "محتاج رقم الطلب عشان اتابعه. رقم الطلب إيه؟"
                    : "I need your order number to track it. What's your order number?";
        }
        return generic(missing, ar);
    }

    /**
     * Stores a new pending action, replacing any previous one, and moves the dialogue to the
     * state matching the first missing field.
     */
    public PendingAction openPendingAction(
            SessionState state,
            String intent,
            Map<String, Object> entities,
            List<String> missing
    ) {
        Map<String, Object> partial = new LinkedHashMap<>();
        if (entities != null) {
            entities.forEach((k, v) -> {
                if (v != null) {
                    partial.put(k, v);
                }
            });
        }
        PendingAction action = PendingAction.builder()
                .actionType(intent)
                .missingFields(new ArrayList<>(missing))
                .partialData(partial)
                .createdAt(clock.instant())
                .retryCount(0)
                .build();
        state.setPendingAction(action);
        state.setDialogueState(DialogueState.awaiting(missing.isEmpty() ? null : missing.get(0)));
        return action;
    }

    /**
     * Merges what the follow-up message supplies into the pending action. When nothing is
     * missing any more the action is cleared from the session and returned as resolved.
     */
    public PendingResolution resolvePendingAction(
            SessionState state,
            String message,
            Map<String, Object> extracted
    ) {
        PendingAction action = state.getPendingAction();
        if (action == null) {
            return new PendingResolution(false, null, Map.of(), List.of());
        }
        Map<String, Object> update = new LinkedHashMap<>();
        if (extracted != null) {
            extracted.forEach((k, v) -> {
                if (v != null && !(v instanceof String s && s.isBlank())) {
                    update.put(k, v);
                }
            });
        }
        for (String field : action.getMissingFields()) {
            if (!update.containsKey(field)) {
                extractFromContext(message, field).ifPresent(value -> update.put(field, value));
            }
        }
        action.getPartialData().putAll(update);

        List<String> stillMissing = needsClarification(action.getActionType(), action.getPartialData()).missingFields();
        if (stillMissing.isEmpty()) {
            state.setPendingAction(null);
            state.setDialogueState(DialogueState.IDLE);
            return new PendingResolution(true, action.getActionType(), new LinkedHashMap<>(action.getPartialData()), List.of());
        }
        action.setMissingFields(new ArrayList<>(stillMissing));
        action.setRetryCount(action.getRetryCount() + 1);
        state.setDialogueState(DialogueState.awaiting(stillMissing.get(0)));
        return new PendingResolution(false, action.getActionType(), new LinkedHashMap<>(action.getPartialData()), stillMissing);
    }

    /**
     * Reads a single missing field out of a short follow-up answer such as "large" or "2".
     */
    public Optional<Object> extractFromContext(String message, String missingField) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT).trim();
        if (lower.isEmpty()) {
            return Optional.empty();
        }
        switch (missingField) {
            case EntityKey.SIZE -> {
                Set<String> tokens = new HashSet<>(Arrays.asList(TOKEN_SPLIT.split(lower)));
                for (Map.Entry<String, List<String>> entry : SIZE_WORDS.entrySet()) {
                    if (entry.getValue().stream().anyMatch(tokens::contains)) {
                        return Optional.of(entry.getKey());
                    }
                }
                return Optional.empty();
            }
            case EntityKey.QUANTITY -> {
                Matcher m = FIRST_NUMBER.matcher(lower);
                return m.find() ? Optional.of(NumberParsing.saturatedInt(m.group())) : Optional.empty();
            }
            case EntityKey.ORDER_ID -> {
                Matcher m = FIRST_NUMBER.matcher(lower);
                return m.find() ? Optional.of(m.group()) : Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    /**
     * Menu entry an item text refers to: fuzzy lookup of the whole text, then of each word
     * longer than three characters.
     */
    public Optional<MenuItemView> resolveMenuItem(String itemName) {
        if (itemName == null || itemName.isBlank()) {
            return Optional.empty();
        }
        Optional<MenuItemView> item = store.getMenuItem(itemName, false);
        if (item.isPresent()) {
            return item;
        }
        for (String word : itemName.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() > 3) {
                item = store.getMenuItem(word, false);
                if (item.isPresent()) {
                    return item;
                }
            }
        }
        return Optional.empty();
    }

    private String clarifyAddItem(Map<String, Object> entities, List<String> missing, boolean ar) {
        if (missing.contains(EntityKey.ITEM)) {
            return ar
                    ? "عايز تطلب إيه؟ قول اسم البيتزا أو الإضافة."
                    : "What would you like to order? Please tell me the item name.";
        }
        String item = text(entities, EntityKey.ITEM);
        if (missing.contains(EntityKey.SIZE) && item != null) {
            List<MenuSizeView> sizes = resolveMenuItem(item)
                    .map(menuItem -> store.getAvailableSizes(menuItem.id()))
                    .orElse(List.of());
            if (sizes.isEmpty()) {
                return ar
                        ? "آسف، مش لاقي '" + item + "' في القائمة. ممكن تتأكد من الاسم؟"
                        : "Sorry, I couldn't find '" + item + "' in our menu. Could you check the name?";
            }
            return ar
                    ? "أي حجم عايز من " + item + "؟\n" + formatSizes(sizes, true)
                    : "What size would you like for " + item + "?\n" + formatSizes(sizes, false);
        }
        return generic(missing, ar);
    }

    private String clarifyRemoveItem(List<String> missing, boolean ar, CartSnapshot cart) {
        if (cart == null || cart.isEmpty()) {
            return ar ? "السلة فاضية، مفيهاش حاجة." : "Your cart is empty. There's nothing to remove.";
        }
        if (missing.contains(EntityKey.ITEM)) {
            String lines = cart.items().stream()
                    .map(this::cartLine)
                    .collect(Collectors.joining("\n"));
            return ar
                    ? "عايز تشيل إيه؟\nفي السلة دلوقتي:\n" + lines
                    : "What would you like to remove?\nCurrently in your cart:\n" + lines;
        }
        return generic(missing, ar);
    }

    private String generic(List<String> missing, boolean ar) {
        return ar
                ? "محتاج معلومات إضافية: " + String.join("، ", missing)
                : "I need more information: " + String.join(", ", missing);
    }

    private String formatSizes(List<MenuSizeView> sizes, boolean ar) {
        Map<String, String> names = ar ? SIZE_NAMES_AR : SIZE_NAMES_EN;
        String currency = ar ? "جنيه" : MoneyFormat.CURRENCY;
        return sizes.stream()
                .map(s -> "  • " + names.getOrDefault(s.size(), s.size()) + " (" + s.size() + ") - "
                        + MoneyFormat.amount(s.price()) + " " + currency)
                .collect(Collectors.joining("\n"));
    }

    private String cartLine(CartLine line) {
        return "  • " + line.itemName() + " (" + line.size() + ") × " + line.quantity();
    }

    private boolean isSimpleAddition(String item) {
        String lower = item.toLowerCase(Locale.ROOT);
        return SIMPLE_ADDITIONS.stream().anyMatch(lower::contains);
    }

    private static String text(Map<String, Object> entities, String key) {
        if (entities == null) {
            return null;
        }
        Object value = entities.get(key);
        if (value == null) {
            return null;
        }
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }

    private static Map<String, List<String>> sizeWords() {
        Map<String, List<String>> words = new LinkedHashMap<>();
        words.put("S", List.of("small", "s", "صغير", "ص"));
        words.put("M", List.of("medium", "m", "متوسط", "م"));
        words.put("L", List.of("large", "l", "big", "كبير", "ك"));
        words.put("REG", List.of("regular", "reg", "عادي", "عاد"));
        return words;
    }
}
