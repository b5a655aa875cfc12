package com.github.salilvnair.orderbot.clarification;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.model.DialogueState;
import com.github.salilvnair.orderbot.engine.model.PendingAction;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import com.github.salilvnair.orderbot.store.model.CartSnapshot;
import com.github.salilvnair.orderbot.support.InMemoryOrderingStore;
import com.github.salilvnair.orderbot.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class ClarificationServiceTest {

    private final InMemoryOrderingStore store = new InMemoryOrderingStore();
    private final ClarificationService service =
            new ClarificationService(store, new MutableClock(Instant.parse("2026-01-15T12:00:00Z")));

    @Test
    void pizzaWithoutSizeNeedsSize() {
        ClarificationCheck check = service.needsClarification(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "pizza"));

        assertTrue(check.needed());
        assertEquals(List.of(EntityKey.SIZE), check.missingFields());
    }

    @Test
    void singleSizeAdditionNeedsOnlyName() {
        assertFalse(service.needsClarification(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "fries")).needed());
        assertFalse(service.needsClarification(IntentCode.VIEW_CART, Map.of()).needed());
        assertFalse(service.needsClarification(null, Map.of()).needed());
    }

    @Test
    void sizeQuestionListsPricesOfResolvedItem() {
        String question = service.generateQuestion(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "pizza"),
                List.of(EntityKey.SIZE), LanguageCode.EN, CartSnapshot.empty());

        assertEquals("What size would you like for pizza?\n"
                + "  • Small (S) - 83 EGP\n"
                + "  • Medium (M) - 100 EGP\n"
                + "  • Large (L) - 140 EGP", question);
    }

    @Test
    void sizeQuestionOmitsUnavailableSizes() {
        InMemoryOrderingStore spyStore = spy(new InMemoryOrderingStore());
        spyStore.disableSize(MARGHERITA, "M");
        ClarificationService spied =
                new ClarificationService(spyStore, new MutableClock(Instant.parse("2026-01-15T12:00:00Z")));

        String question = spied.generateQuestion(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "pizza"),
                List.of(EntityKey.SIZE), LanguageCode.EN, CartSnapshot.empty());

        assertEquals("What size would you like for pizza?\n"
                + "  • Small (S) - 83 EGP\n"
                + "  • Large (L) - 140 EGP", question);
        verify(spyStore).getAvailableSizes(anyLong());
    }

    @Test
    void arabicSizeQuestionUsesArabicNamesAndCurrency() {
        String question = service.generateQuestion(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "margherita"),
                List.of(EntityKey.SIZE), LanguageCode.AR, CartSnapshot.empty());

        assertEquals("أي حجم عايز من margherita؟\n"
                + "  • صغير (S) - 83 جنيه\n"
                + "  • متوسط (M) - 100 جنيه\n"
                + "  • كبير (L) - 140 جنيه", question);
    }

    @Test
    void unknownItemQuestionAsksToCheckName() {
        String question = service.generateQuestion(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "sushi"),
                List.of(EntityKey.SIZE), LanguageCode.EN, CartSnapshot.empty());

        assertEquals("Sorry, I couldn't find 'sushi' in our menu. Could you check the name?", question);
    }

    @Test
    void removeQuestionDependsOnCart() {
        assertEquals("Your cart is empty. There's nothing to remove.",
                service.generateQuestion(IntentCode.REMOVE_ITEM, Map.of(), List.of(EntityKey.ITEM),
                        LanguageCode.EN, CartSnapshot.empty()));

        store.addToCart(USER_ID, store.size(COLA, SIZE_REG).id(), 2);
        String question = service.generateQuestion(IntentCode.REMOVE_ITEM, Map.of(), List.of(EntityKey.ITEM),
                LanguageCode.EN, store.getCart(USER_ID));

        assertEquals("What would you like to remove?\nCurrently in your cart:\n  • Cola (REG) × 2", question);
    }

    @Test
    void extractFromContextReadsShortAnswers() {
        assertEquals(Optional.of("L"), service.extractFromContext("big one please", EntityKey.SIZE));
        assertEquals(Optional.of("S"), service.extractFromContext("Small", EntityKey.SIZE));
        assertEquals(Optional.of(3), service.extractFromContext("make it 3", EntityKey.QUANTITY));
        assertEquals(Optional.of("1001"), service.extractFromContext("#1001", EntityKey.ORDER_ID));
        assertTrue(service.extractFromContext("something else", EntityKey.SIZE).isEmpty());
    }

    @Test
    void pendingActionResolvesOnFollowUp() {
        SessionState state = new SessionState();
        service.openPendingAction(state, IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "pizza"), List.of(EntityKey.SIZE));

        assertEquals(DialogueState.AWAITING_SIZE, state.getDialogueState());

        PendingResolution resolution = service.resolvePendingAction(state, TEXT_LARGE, Map.of());

        assertTrue(resolution.resolved());
        assertEquals(IntentCode.ADD_ITEM, resolution.intent());
        assertEquals(Map.of(EntityKey.ITEM, "pizza", EntityKey.SIZE, SIZE_L), resolution.entities());
        assertNull(state.getPendingAction());
        assertEquals(DialogueState.IDLE, state.getDialogueState());
    }

    @Test
    void unhelpfulFollowUpCountsRetry() {
        SessionState state = new SessionState();
        service.openPendingAction(state, IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "pizza"), List.of(EntityKey.SIZE));

        PendingResolution resolution = service.resolvePendingAction(state, "hmm", Map.of());

        assertFalse(resolution.resolved());
        assertEquals(List.of(EntityKey.SIZE), resolution.stillMissing());
        PendingAction action = state.getPendingAction();
        assertEquals(1, action.getRetryCount());
    }

    @Test
    void resolveMenuItemFallsBackToSingleWords() {
        assertEquals(MARGHERITA, service.resolveMenuItem("margherita").orElseThrow().name());
        assertEquals(MANGO_JUICE, service.resolveMenuItem("fresh mango").orElseThrow().name());
        assertTrue(service.resolveMenuItem("xyz").isEmpty());
    }
}
