package com.github.salilvnair.orderbot.llm.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.llm.core.LlmClient;
import com.github.salilvnair.orderbot.template.ThymeleafTemplateRenderer;
import com.github.salilvnair.orderbot.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link FallbackProvider} backed by an {@link LlmClient}. Every failure is logged and
 * reported as an empty result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "orderbot.llm", name = "enabled", havingValue = "true")
public class LlmFallbackProvider implements FallbackProvider {

    public static final String EXTRACT_PROMPT = "prompts/extract-intent.txt";
    public static final String REPLY_PROMPT = "prompts/generate-reply.txt";

    static final Map<String, String> INTENT_DESCRIPTIONS = intentDescriptions();

    private final LlmClient llmClient;
    private final ThymeleafTemplateRenderer renderer;

    @Override
    public Optional<FallbackIntent> extractIntent(String text, String language) {
        try {
            Map<String, Object> vars = new LinkedHashMap<>();
            vars.put("intents", INTENT_DESCRIPTIONS);
            vars.put("entityKeys", EntityKey.VOCABULARY);
            vars.put("language", language);
            vars.put("query", text);
            String prompt = renderer.renderResource(EXTRACT_PROMPT, vars);
            String raw = llmClient.generateJson(null, prompt);
            return parseIntent(raw);
        } catch (Exception e) {
            log.warn("LLM intent extraction failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> generateReply(String text, String contextBlob, String language) {
        try {
            Map<String, Object> vars = new LinkedHashMap<>();
            vars.put("language", language);
            vars.put("context", contextBlob == null ? "" : contextBlob);
            vars.put("query", text);
            String prompt = renderer.renderResource(REPLY_PROMPT, vars);
            String reply = llmClient.generateText(null, prompt);
            if (reply == null || reply.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(reply.trim());
        } catch (Exception e) {
            log.warn("LLM reply generation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    Optional<FallbackIntent> parseIntent(String raw) {
        Optional<JsonNode> parsed = LlmJsonExtractor.extractObject(raw);
        if (parsed.isPresent()) {
            JsonNode node = parsed.get();
            String intent = normalizeIntent(node.path("intent").asText(null));
            Map<String, Object> entities = new LinkedHashMap<>();
            JsonUtil.toMap(node.path("entities")).forEach((k, v) -> {
                String key = k.toLowerCase(Locale.ROOT);
                if (v != null && EntityKey.VOCABULARY.contains(key)) {
                    entities.put(key, v);
                }
            });
            Double confidence = node.path("confidence").isNumber() ? node.path("confidence").asDouble() : null;
            return Optional.of(new FallbackIntent(intent, entities, confidence));
        }
        return LlmJsonExtractor.extractBareIntent(raw)
                .map(LlmFallbackProvider::normalizeIntent)
                .filter(Objects::nonNull)
                .map(intent -> new FallbackIntent(intent, Map.of(), null));
    }

    private static String normalizeIntent(String intent) {
        if (intent == null) {
            return null;
        }
        String code = intent.trim().toLowerCase(Locale.ROOT);
        return INTENT_DESCRIPTIONS.containsKey(code) ? code : null;
    }

    private static Map<String, String> intentDescriptions() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put(IntentCode.WELCOME, "greetings (hi, hello)");
        m.put(IntentCode.ADD_ITEM, "add items to cart");
        m.put(IntentCode.REMOVE_ITEM, "remove from cart");
        m.put(IntentCode.VIEW_CART, "show cart");
        m.put(IntentCode.CLEAR_CART, "empty cart");
        m.put(IntentCode.CHECKOUT, "place/confirm order");
        m.put(IntentCode.BROWSE_MENU, "show menu");
        m.put(IntentCode.TRACK_ORDER, "check order status");
        m.put(IntentCode.NEW_ORDER, "start new order");
        m.put(IntentCode.CONFIRMATION, "yes/ok/sure");
        m.put(IntentCode.REJECTION, "no/nope");
        m.put(IntentCode.UNKNOWN, "anything else");
        return Collections.unmodifiableMap(m);
    }
}
