package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.ConversationTurn;
import com.github.salilvnair.orderbot.engine.pipeline.DialogueStep;
import com.github.salilvnair.orderbot.engine.pipeline.StepResult;
import com.github.salilvnair.orderbot.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.orderbot.llm.fallback.FallbackProvider;
import com.github.salilvnair.orderbot.recommendation.Recommendation;
import com.github.salilvnair.orderbot.recommendation.RecommendationProvider;
import com.github.salilvnair.orderbot.util.JsonUtil;
import com.github.salilvnair.orderbot.util.MoneyFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

/**
 * Decides the reply text. Structured results always win over generated text where
 * numbers matter, so checkout and the cart/menu intents never go through the fallback provider.
 */
@Slf4j
@Component
@MustRunAfter(RoutingStep.class)
public class ResponseStep implements DialogueStep {

    static final Set<String> DETERMINISTIC_INTENTS = Set.of(
            IntentCode.VIEW_CART, IntentCode.CLEAR_CART, IntentCode.BROWSE_MENU,
            IntentCode.CHECKOUT, IntentCode.CONFIRMATION, IntentCode.REJECTION
    );

    static final Set<String> ADD_HANDLERS = Set.of(IntentCode.ADD_ITEM, IntentCode.BATCH_ADD_ITEM);

    enum ReplyMode {
        KEEP,
        CHECKOUT_SUMMARY,
        DETERMINISTIC,
        GENERATIVE,
        HANDLER_OR_DEFAULT
    }

    private final ObjectProvider<FallbackProvider> fallbackProvider;
    private final ObjectProvider<RecommendationProvider> recommendationProvider;
    private final OrderBotProperties properties;

    public ResponseStep(
            ObjectProvider<FallbackProvider> fallbackProvider,
            ObjectProvider<RecommendationProvider> recommendationProvider,
            OrderBotProperties properties
    ) {
        this.fallbackProvider = fallbackProvider;
        this.recommendationProvider = recommendationProvider;
        this.properties = properties;
    }

    @Override
    public StepResult execute(DialogueContext context) {
        ReplyMode mode = decide(context);
        switch (mode) {
            case KEEP -> {
                // clarification question or suggestion already in place
            }
            case CHECKOUT_SUMMARY -> context.setBotResponse(checkoutSummary(context.getHandlerResult(), context.getLanguage()));
            case DETERMINISTIC -> context.setBotResponse(deterministicReply(context));
            case GENERATIVE -> context.setBotResponse(generativeReply(context));
            case HANDLER_OR_DEFAULT -> context.setBotResponse(handlerOrDefault(context));
        }
        if (!context.hasReply()) {
            context.setBotResponse(defaultReply(context));
        }
        if (mode != ReplyMode.KEEP) {
            appendRecommendations(context);
        }
        context.setSuggestedActions(new ArrayList<>(suggestedActions(context)));
        return new StepResult.Continue();
    }

    ReplyMode decide(DialogueContext context) {
        if (context.hasReply()) {
            return ReplyMode.KEEP;
        }
        if (context.isIntent(IntentCode.CHECKOUT) && context.isHandlerSuccess()) {
            return ReplyMode.CHECKOUT_SUMMARY;
        }
        if (context.hasIntent() && DETERMINISTIC_INTENTS.contains(context.getIntent())) {
            return ReplyMode.DETERMINISTIC;
        }
        if (fallbackProvider.getIfAvailable() != null) {
            return ReplyMode.GENERATIVE;
        }
        return ReplyMode.HANDLER_OR_DEFAULT;
    }

    static String checkoutSummary(Map<String, Object> result, String language) {
        StringBuilder sb = new StringBuilder("✅ Order placed successfully!\n\n");
        Object items = result.get(ResultKey.ITEMS);
        if (items instanceof List<?> lines) {
            for (Object line : lines) {
                if (line instanceof Map<?, ?> item) {
                    sb.append("• ").append(item.get("quantity")).append("x ")
                            .append(item.get("size")).append(' ')
                            .append(item.get("name")).append(" - ")
                            .append(amount(item.get("subtotal"))).append(' ').append(MoneyFormat.CURRENCY)
                            .append('\n');
                }
            }
        }
        sb.append("\n💰 Total: ").append(amount(result.get(ResultKey.TOTAL_PRICE))).append(' ').append(MoneyFormat.CURRENCY);
        sb.append("\n📦 Order ID: #").append(result.get(ResultKey.ORDER_ID));
        sb.append(LanguageCode.isArabic(language)
                ? "\n\nطلبك هيكون جاهز خلال 30-40 دقيقة!"
                : "\n\nYour order will be ready in 30-40 minutes!");
        return sb.toString();
    }

    private String deterministicReply(DialogueContext context) {
        if (!context.isHandlerExecuted()) {
            return defaultReply(context);
        }
        return firstText(context.getHandlerResult(), ResultKey.MESSAGE, ResultKey.SUMMARY, ResultKey.ERROR);
    }

    private String generativeReply(DialogueContext context) {
        FallbackProvider provider = fallbackProvider.getIfAvailable();
        Optional<String> generated = Optional.empty();
        if (provider != null) {
            try {
                generated = provider.generateReply(context.getUserMessage(), contextBlob(context), context.getLanguage());
            } catch (RuntimeException e) {
                log.warn("Reply generation failed userId={}: {}", context.getUserId(), e.getMessage());
            }
        }
        return generated.filter(s -> !s.isBlank()).orElseGet(() -> handlerOrDefault(context));
    }

    private String handlerOrDefault(DialogueContext context) {
        Map<String, Object> result = context.getHandlerResult();
        if (!context.isHandlerExecuted() || Boolean.TRUE.equals(result.get(ResultKey.FALLBACK_TO_LLM))) {
            return defaultReply(context);
        }
        String text = firstText(result, ResultKey.MESSAGE, ResultKey.SUMMARY, ResultKey.ERROR);
        return text == null ? defaultReply(context) : text;
    }

    String contextBlob(DialogueContext context) {
        int limit = properties.getDialogue().getPromptHistory();
        List<ConversationTurn> history = context.getHistory();
        List<ConversationTurn> recent = history.size() > limit ? history.subList(history.size() - limit, history.size()) : history;

        StringBuilder sb = new StringBuilder("Conversation History:\n");
        for (ConversationTurn turn : recent) {
            sb.append(turn.role()).append(": ").append(turn.content()).append('\n');
        }
        sb.append("\nUser's current message: ").append(context.getUserMessage()).append("\n\n");
        if (context.isHandlerExecuted()) {
            sb.append("Handler executed: ").append(context.getHandlerName()).append('\n');
        } else {
            sb.append("No specific handler for intent: ").append(context.getIntent()).append('\n');
        }
        sb.append("\nACTUAL DATA (do not modify or guess):\nhandler_result: ")
                .append(JsonUtil.toPrettyJson(context.getHandlerResult()))
                .append("\n\nCurrent cart: ")
                .append(JsonUtil.toJson(context.getCart().toMap()))
                .append("\n\nUse the exact items, quantities and prices above. Keep it to one or two sentences.");
        return sb.toString();
    }

    private void appendRecommendations(DialogueContext context) {
        if (!properties.getRecommendations().isEnabled()
                || !context.isHandlerSuccess()
                || !ADD_HANDLERS.contains(context.getHandlerName())) {
            return;
        }
        RecommendationProvider provider = recommendationProvider.getIfAvailable();
        if (provider == null) {
            return;
        }
        try {
            List<Recommendation> picks = provider.getRecommendations(
                    context.getUserId(), context.getCart(), properties.getRecommendations().getMaxItems());
            if (picks.isEmpty()) {
                return;
            }
            context.setRecommendations(new ArrayList<>(picks));
            String text = provider.formatRecommendationsText(picks, context.getLanguage());
            if (!text.isBlank()) {
                context.setBotResponse(context.getBotResponse() + "\n\n" + text.stripTrailing());
            }
        } catch (RuntimeException e) {
            log.warn("Recommendations failed userId={}: {}", context.getUserId(), e.getMessage());
        }
    }

    static String defaultReply(DialogueContext context) {
        boolean ar = LanguageCode.isArabic(context.getLanguage());
        String intent = context.getIntent();
        if (IntentCode.WELCOME.equals(intent)) {
            return ar
                    ? "أهلاً بيك! 🍕 تحب تطلب إيه النهارده؟ قول 'المنيو' عشان تشوف الأصناف."
                    : "Welcome! 🍕 What would you like to order today? Say 'menu' to see what we have.";
        }
        if (IntentCode.CHECKOUT.equals(intent)) {
            return ar
                    ? "السلة فاضية. ضيف حاجة الأول قبل ما تأكد الطلب."
                    : "Your cart is empty. Add something before checking out.";
        }
        if (IntentCode.NEW_ORDER.equals(intent)) {
            return ar
                    ? "تمام! يلا نبدأ طلب جديد. تحب تطلب إيه؟"
                    : "Sure! Let's start a new order. What would you like?";
        }
        if (IntentCode.TRACK_ORDER.equals(intent)) {
            return ar
                    ? "تتبع الطلبات مش متاح في الشات لسه. الطلب بيكون جاهز خلال 30-40 دقيقة من وقت تأكيده."
                    : "Order tracking isn't available in chat yet. Orders are ready 30-40 minutes after they are placed.";
        }
        return ar
                ? "مش فاهم طلبك. جرب: 'ضيف [صنف] [حجم]'، 'اعرض السلة'، أو 'اطلب'"
                : "I understand your message, but I need more specific menu commands. Try: 'add [item] [size]', 'show cart', or 'checkout'";
    }

    static List<String> suggestedActions(DialogueContext context) {
        if (context.isClarificationNeeded()) {
            return List.of();
        }
        String handler = context.getHandlerName() == null ? context.getIntent() : context.getHandlerName();
        if (handler == null) {
            return List.of("Show menu", "View cart");
        }
        return switch (handler) {
            case IntentCode.ADD_ITEM, IntentCode.BATCH_ADD_ITEM, IntentCode.CONFIRMATION ->
                    context.isHandlerSuccess() ? List.of("View cart", "Checkout") : List.of("Show menu");
            case IntentCode.REMOVE_ITEM, IntentCode.VIEW_CART ->
                    context.getCart().isEmpty() ? List.of("Show menu") : List.of("Checkout", "Clear cart");
            case IntentCode.CHECKOUT -> context.isHandlerSuccess() ? List.of("Track order", "New order") : List.of("Show menu");
            case IntentCode.BROWSE_MENU, IntentCode.CLEAR_CART, IntentCode.REJECTION, IntentCode.NEW_ORDER -> List.of("Add item", "View cart");
            case IntentCode.WELCOME -> List.of("Show menu");
            default -> List.of("Show menu", "View cart");
        };
    }

    private static String firstText(Map<String, Object> result, String... keys) {
        for (String key : keys) {
            Object value = result.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private static String amount(Object value) {
        if (value instanceof BigDecimal decimal) {
            return MoneyFormat.amount(decimal);
        }
        if (value instanceof Number number) {
            return MoneyFormat.amount(new BigDecimal(number.toString()));
        }
        return String.valueOf(value);
    }
}
