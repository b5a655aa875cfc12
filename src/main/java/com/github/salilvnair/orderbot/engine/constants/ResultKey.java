package com.github.salilvnair.orderbot.engine.constants;

public final class ResultKey {

    private ResultKey() {
    }

    public static final String SUCCESS = "success";
    public static final String MESSAGE = "message";
    public static final String ERROR = "error";
    public static final String SUMMARY = "summary";
    public static final String SUGGESTION = "suggestion";
    public static final String SUGGESTION_CREATED = "suggestion_created";
    public static final String ITEM = "item";
    public static final String ITEMS = "items";
    public static final String ORDER_ID = "order_id";
    public static final String TOTAL_PRICE = "total_price";
    public static final String ADDED_ITEMS = "added_items";
    public static final String FAILED_ITEMS = "failed_items";
    public static final String TOTAL_ITEMS = "total_items";
    public static final String CLARIFICATION_NEEDED = "clarification_needed";
    public static final String MISSING_FIELDS = "missing_fields";
    public static final String FALLBACK_TO_LLM = "fallback_to_llm";
    public static final String EXPIRED = "expired";
}
