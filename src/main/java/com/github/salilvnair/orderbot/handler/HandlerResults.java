package com.github.salilvnair.orderbot.handler;

import com.github.salilvnair.orderbot.engine.constants.ResultKey;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;

@UtilityClass
public final class HandlerResults {

    public static Map<String, Object> success(String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, true);
        result.put(ResultKey.MESSAGE, message);
        return result;
    }

    public static Map<String, Object> failure(String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(ResultKey.SUCCESS, false);
        result.put(ResultKey.ERROR, error);
        return result;
    }
}
