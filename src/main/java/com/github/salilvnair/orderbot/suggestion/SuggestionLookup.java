package com.github.salilvnair.orderbot.suggestion;

import com.github.salilvnair.orderbot.engine.model.PendingSuggestion;

public record SuggestionLookup(Status status, PendingSuggestion suggestion) {

    public enum Status {
        NONE,
        EXPIRED,
        ACTIVE
    }
}
