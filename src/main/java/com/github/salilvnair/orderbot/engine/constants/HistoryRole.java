package com.github.salilvnair.orderbot.engine.constants;

public final class HistoryRole {

    private HistoryRole() {
    }

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
}
