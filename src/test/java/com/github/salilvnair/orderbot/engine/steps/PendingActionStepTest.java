package com.github.salilvnair.orderbot.engine.steps;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import com.github.salilvnair.orderbot.engine.context.DialogueContext;
import com.github.salilvnair.orderbot.engine.model.DialogueState;
import com.github.salilvnair.orderbot.engine.model.ExtractionResult;
import com.github.salilvnair.orderbot.engine.model.ExtractionSource;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.support.OrderBotHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class PendingActionStepTest {

    private final OrderBotHarness harness = new OrderBotHarness();
    private final PendingActionStep step = new PendingActionStep(harness.clarificationService, harness.properties);
    private final SessionState state = new SessionState();

    @BeforeEach
    void openSizeQuestion() {
        harness.clarificationService.openPendingAction(
                state, IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "pizza"), List.of(EntityKey.SIZE));
    }

    @Test
    void followUpCompletesPendingAction() {
        DialogueContext context = context(TEXT_LARGE, null, Map.of());

        step.execute(context);

        assertEquals(IntentCode.ADD_ITEM, context.getIntent());
        assertEquals(SIZE_L, context.entityText(EntityKey.SIZE));
        assertEquals("pizza", context.entityText(EntityKey.ITEM));
        assertFalse(context.hasReply());
        assertNull(state.getPendingAction());
    }

    @Test
    void unhelpfulFollowUpAsksAgain() {
        DialogueContext context = context("hmm", null, Map.of());

        step.execute(context);

        assertTrue(context.isClarificationNeeded());
        assertTrue(context.getBotResponse().startsWith("What size would you like for pizza?"));
        assertEquals(List.of(EntityKey.SIZE), context.getHandlerResult().get(ResultKey.MISSING_FIELDS));
        assertEquals(1, state.getPendingAction().getRetryCount());
    }

    @Test
    void differentIntentDiscardsPendingAction() {
        DialogueContext context = context(TEXT_SHOW_CART, IntentCode.VIEW_CART, Map.of());

        step.execute(context);

        assertEquals(IntentCode.VIEW_CART, context.getIntent());
        assertNull(state.getPendingAction());
        assertEquals(DialogueState.IDLE, state.getDialogueState());
    }

    @Test
    void exhaustedRetriesDiscardPendingAction() {
        state.getPendingAction().setRetryCount(harness.properties.getDialogue().getPendingActionMaxRetries());
        DialogueContext context = context(TEXT_LARGE, null, Map.of());

        step.execute(context);

        assertNull(context.getIntent());
        assertNull(state.getPendingAction());
        assertFalse(context.hasReply());
    }

    private DialogueContext context(String text, String intent, Map<String, Object> entities) {
        DialogueContext context = new DialogueContext(USER_ID, text);
        context.applyExtraction(new ExtractionResult(intent, entities, LanguageCode.EN,
                ExtractionSource.PATTERN, 1.0d, List.of()));
        context.setSessionState(state);
        return context;
    }
}
