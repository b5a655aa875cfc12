package com.github.salilvnair.orderbot.clarification;

import java.util.List;

public record ClarificationCheck(boolean needed, List<String> missingFields) {

    public ClarificationCheck {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static ClarificationCheck none() {
        return new ClarificationCheck(false, List.of());
    }
}
