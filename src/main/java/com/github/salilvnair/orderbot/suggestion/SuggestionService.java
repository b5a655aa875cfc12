package com.github.salilvnair.orderbot.suggestion;

import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.model.DialogueState;
import com.github.salilvnair.orderbot.engine.model.PendingSuggestion;
import com.github.salilvnair.orderbot.engine.model.SessionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Pending suggestion bookkeeping. A user has at most one suggestion awaiting a yes/no;
 * expiry is only checked when the suggestion is looked up.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuggestionService {

    private final Clock clock;
    private final OrderBotProperties properties;

    public PendingSuggestion createAddItemSuggestion(String item, String size, int quantity) {
        return PendingSuggestion.builder()
                .actionType(IntentCode.ADD_ITEM)
                .item(item)
                .size(size == null || size.isBlank() ? "REG" : size)
                .quantity(Math.max(quantity, 1))
                .createdAt(clock.instant())
                .build();
    }

    /** Replaces any earlier suggestion. */
    public void setPendingSuggestion(SessionState state, PendingSuggestion suggestion) {
        state.setPendingSuggestion(suggestion);
        state.setDialogueState(DialogueState.AWAITING_CONFIRMATION);
    }

    /**
     * Current suggestion of the session. An expired suggestion is cleared and reported as
     * {@link SuggestionLookup.Status#EXPIRED}.
     */
    public SuggestionLookup lookup(SessionState state) {
        PendingSuggestion suggestion = state.getPendingSuggestion();
        if (suggestion == null) {
            return new SuggestionLookup(SuggestionLookup.Status.NONE, null);
        }
        if (isExpired(suggestion)) {
            log.debug("Pending suggestion for '{}' expired (created {})", suggestion.getItem(), suggestion.getCreatedAt());
            clear(state);
            return new SuggestionLookup(SuggestionLookup.Status.EXPIRED, suggestion);
        }
        return new SuggestionLookup(SuggestionLookup.Status.ACTIVE, suggestion);
    }

    /** Clears the suggestion; returns whether one existed. */
    public boolean clear(SessionState state) {
        boolean existed = state.getPendingSuggestion() != null;
        state.setPendingSuggestion(null);
        if (state.getDialogueState() == DialogueState.AWAITING_CONFIRMATION) {
            state.setDialogueState(DialogueState.IDLE);
        }
        return existed;
    }

    public boolean isExpired(PendingSuggestion suggestion) {
        Instant createdAt = suggestion.getCreatedAt();
        if (createdAt == null) {
            return true;
        }
        Duration ttl = properties.getDialogue().getSuggestionTtl();
        return Duration.between(createdAt, clock.instant()).compareTo(ttl) > 0;
    }
}
