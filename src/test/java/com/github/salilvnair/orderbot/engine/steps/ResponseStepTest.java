package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.ExtractionResult;
import com.github.salilvnair.orderbot.engine.model.ExtractionSource;
import com.github.salilvnair.orderbot.handler.HandlerResults;
import com.github.salilvnair.orderbot.llm.fallback.FallbackProvider;
import com.github.salilvnair.orderbot.recommendation.DefaultRecommendationProvider;
import com.github.salilvnair.orderbot.recommendation.RecommendationProvider;
import com.github.salilvnair.orderbot.store.model.CartSnapshot;
import com.github.salilvnair.orderbot.support.InMemoryOrderingStore;
import com.github.salilvnair.orderbot.support.OrderBotHarness;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ResponseStepTest {

    private final InMemoryOrderingStore store = new InMemoryOrderingStore();
    private final OrderBotProperties properties = new OrderBotProperties();

    @Test
    void checkoutSummaryIgnoresGeneratedText() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        when(fallback.generateReply(anyString(), anyString(), anyString())).thenReturn(Optional.of(HALLUCINATED_CHECKOUT));
        ResponseStep step = step(fallback);

        Map<String, Object> line = new LinkedHashMap<>();
        line.put("name", MARGHERITA);
        line.put("size", SIZE_L);
        line.put("quantity", 2);
        line.put("subtotal", new BigDecimal("280"));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, true);
        result.put(ResultKey.ORDER_ID, 1001L);
        result.put(ResultKey.TOTAL_PRICE, new BigDecimal("280"));
        result.put(ResultKey.ITEMS, List.of(line));
        DialogueContext context = executed(IntentCode.CHECKOUT, IntentCode.CHECKOUT, result);

        step.execute(context);

        assertEquals("✅ Order placed successfully!\n\n"
                + "• 2x L Margherita Pizza - 280 EGP\n"
                + "\n💰 Total: 280 EGP"
                + "\n📦 Order ID: #1001"
                + "\n\nYour order will be ready in 30-40 minutes!", context.getBotResponse());
        verifyNoInteractions(fallback);
        assertEquals(List.of("Track order", "New order"), context.getSuggestedActions());
    }

    @Test
    void cartIntentsUseHandlerSummaryEvenWithFallback() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, true);
        result.put(ResultKey.SUMMARY, "Your cart is empty");
        DialogueContext context = executed(IntentCode.VIEW_CART, IntentCode.VIEW_CART, result);

        step(fallback).execute(context);

        assertEquals("Your cart is empty", context.getBotResponse());
        verifyNoInteractions(fallback);
    }

    @Test
    void otherIntentsUseGeneratedReply() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        when(fallback.generateReply(anyString(), anyString(), anyString())).thenReturn(Optional.of(GENERATED_REPLY));
        DialogueContext context = context(IntentCode.WELCOME);

        step(fallback).execute(context);

        assertEquals(GENERATED_REPLY, context.getBotResponse());
    }

    @Test
    void emptyGeneratedReplyFallsBackToDefault() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        when(fallback.generateReply(anyString(), anyString(), anyString())).thenReturn(Optional.empty());
        DialogueContext context = context(IntentCode.WELCOME);

        step(fallback).execute(context);

        assertEquals("Welcome! 🍕 What would you like to order today? Say 'menu' to see what we have.",
                context.getBotResponse());
    }

    @Test
    void withoutFallbackUnknownMessageGetsHelpText() {
        DialogueContext context = context(null);

        step(null).execute(context);

        assertTrue(context.getBotResponse().startsWith("I understand your message"));
        assertEquals(List.of("Show menu", "View cart"), context.getSuggestedActions());
    }

    @Test
    void existingReplyIsKept() {
        DialogueContext context = context(IntentCode.ADD_ITEM);
        context.setClarificationNeeded(true);
        context.setBotResponse("What size would you like for pizza?");

        step(null).execute(context);

        assertEquals("What size would you like for pizza?", context.getBotResponse());
        assertTrue(context.getSuggestedActions().isEmpty());
    }

    @Test
    void successfulAddAppendsRecommendations() {
        store.addToCart(USER_ID, store.size(MARGHERITA, SIZE_L).id(), 1);
        DialogueContext context = executed(IntentCode.ADD_ITEM, IntentCode.ADD_ITEM,
                HandlerResults.success("Added Margherita Pizza (L) x 1 to cart"));
        context.setCart(store.getCart(USER_ID));

        step(null).execute(context);

        assertTrue(context.getBotResponse().startsWith("Added Margherita Pizza (L) x 1 to cart\n\n🎯 Recommendations for you:"));
        assertEquals(List.of(MANGO_JUICE, COLA), context.getRecommendations().stream().map(r -> r.name()).toList());
        assertEquals(List.of("View cart", "Checkout"), context.getSuggestedActions());
    }

    @Test
    void failedAddGetsNoRecommendations() {
        DialogueContext context = executed(IntentCode.ADD_ITEM, IntentCode.ADD_ITEM,
                HandlerResults.failure("'sushi' not found in menu"));

        step(null).execute(context);

        assertEquals("'sushi' not found in menu", context.getBotResponse());
        assertTrue(context.getRecommendations().isEmpty());
    }

    @Test
    void unhandledIntentWithoutFallbackGetsDefaultReply() {
        DialogueContext context = context(IntentCode.TRACK_ORDER);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, false);
        result.put(ResultKey.FALLBACK_TO_LLM, true);
        context.setHandlerResult(result);

        step(null).execute(context);

        assertTrue(context.getBotResponse().startsWith("Order tracking isn't available in chat yet."));
    }

    private ResponseStep step(FallbackProvider fallback) {
        RecommendationProvider recommendations = new DefaultRecommendationProvider(store);
        return new ResponseStep(
                OrderBotHarness.provider(FallbackProvider.class, fallback),
                OrderBotHarness.provider(RecommendationProvider.class, recommendations),
                properties);
    }

    private DialogueContext context(String intent) {
        DialogueContext context = new DialogueContext(USER_ID, "some message");
        context.applyExtraction(new ExtractionResult(intent, Map.of(), LanguageCode.EN,
                ExtractionSource.PATTERN, 1.0d, List.of()));
        context.setCart(CartSnapshot.empty());
        return context;
    }

    private DialogueContext executed(String intent, String handler, Map<String, Object> result) {
        DialogueContext context = context(intent);
        context.setHandlerExecuted(true);
        context.setHandlerName(handler);
        context.setHandlerResult(result);
        return context;
    }
}
