package com.github.salilvnair.orderbot.engine.model;

import lombok.Data;

/**
 * Cross-turn dialogue state of one user. Loaded from the store at the start of a turn
 * and written back at its end.
 */
@Data
public class SessionState {
    private PendingAction pendingAction;
    private PendingSuggestion pendingSuggestion;
    private DialogueState dialogueState = DialogueState.IDLE;

    public boolean hasPendingAction() {
        return pendingAction != null;
    }

    public boolean hasPendingSuggestion() {
        return pendingSuggestion != null;
    }
}
