package com.github.salilvnair.orderbot.llm.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.orderbot.util.JsonUtil;
import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of raw model output. Models wrap JSON in prose or code fences,
 * so several readings are tried in order.
 */
@UtilityClass
public final class LlmJsonExtractor {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern EMBEDDED = Pattern.compile("\\{.*}", Pattern.DOTALL);
    private static final Pattern BARE_WORD = Pattern.compile("^[\\s\"'`]*([a-z_]+)[\\s\"'`.]*$");

    public static Optional<JsonNode> extractObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();

        Optional<JsonNode> direct = asObject(text);
        if (direct.isPresent()) {
            return direct;
        }
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            Optional<JsonNode> node = asObject(fenced.group(1));
            if (node.isPresent()) {
                return node;
            }
        }
        Matcher embedded = EMBEDDED.matcher(text);
        if (embedded.find()) {
            return asObject(embedded.group());
        }
        return Optional.empty();
    }

    /** Last resort: a reply whose first line is a single intent word such as {@code view_cart}. */
    public static Optional<String> extractBareIntent(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String firstLine = raw.trim().split("\\R", 2)[0].toLowerCase(Locale.ROOT);
        Matcher matcher = BARE_WORD.matcher(firstLine);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<JsonNode> asObject(String candidate) {
        JsonNode node = JsonUtil.parseOrNull(candidate);
        return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    }
}
