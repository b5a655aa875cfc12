package com.github.salilvnair.orderbot.handler.impl;

import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.support.OrderBotHarness;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class RejectionHandlerTest {

    private final OrderBotHarness harness = new OrderBotHarness();
    private final RejectionHandler handler = new RejectionHandler(harness.suggestionService);

    @Test
    void rejectionClearsPendingSuggestion() {
        SessionState state = new SessionState();
        harness.suggestionService.setPendingSuggestion(state,
                harness.suggestionService.createAddItemSuggestion(MARGHERITA, SIZE_L, 1));
        DialogueContext context = new DialogueContext(USER_ID, TEXT_NO);
        context.setSessionState(state);

        handler.execute(context);

        assertNull(state.getPendingSuggestion());
        assertEquals(true, context.getHandlerResult().get("suggestion_cleared"));
        assertEquals("No problem! What would you like to order instead?",
                context.getHandlerResult().get(ResultKey.MESSAGE));
    }

    @Test
    void rejectionWithoutSuggestionStillSucceeds() {
        DialogueContext context = handler.execute(new DialogueContext(USER_ID, TEXT_NO));

        assertEquals(true, context.getHandlerResult().get(ResultKey.SUCCESS));
        assertEquals("Okay! How can I help you?", context.getHandlerResult().get(ResultKey.MESSAGE));
    }
}
