package com.github.salilvnair.orderbot.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExtractionSource {
    PATTERN("pattern"),
    FALLBACK("fallback"),
    NONE("none"),
    ERROR("error");

    private final String value;

    ExtractionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
