package com.github.salilvnair.orderbot.entity.converter;

import com.github.salilvnair.orderbot.util.JsonUtil;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores history metadata as a JSON text column. Unreadable rows load as empty metadata.
 */
@Slf4j
@Converter
public class JsonMapConverter implements AttributeConverter<Map<String, Object>, String> {

    @Override
    public String convertToDatabaseColumn(Map<String, Object> attribute) {
        return attribute == null ? null : JsonUtil.toJson(attribute);
    }

    @Override
    public Map<String, Object> convertToEntityAttribute(String dbData) {
        try {
            return JsonUtil.toMap(dbData);
        } catch (IllegalStateException e) {
            log.warn("Unreadable history metadata, loading as empty: {}", e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
