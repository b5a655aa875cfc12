package com.github.salilvnair.orderbot.llm.core;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.util.JsonUtil;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Map;

/**
 * Chat-completions client for OpenAI-compatible endpoints (OpenAI, Groq and the like).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "orderbot.llm", name = "enabled", havingValue = "true")
public class OpenAiCompatibleLlmClient implements LlmClient {

    static final String CONTENT_PATH = "$.choices[0].message.content";

    private final OrderBotProperties.Llm config;
    private final HttpClient httpClient;

    public OpenAiCompatibleLlmClient(OrderBotProperties properties) {
        this.config = properties.getLlm();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build();
    }

    @Override
    public String generateText(String systemPrompt, String userPrompt) {
        return complete(systemPrompt, userPrompt, false);
    }

    @Override
    public String generateJson(String systemPrompt, String userPrompt) {
        return complete(systemPrompt, userPrompt, true);
    }

    private String complete(String systemPrompt, String userPrompt, boolean jsonMode) {
        String body = JsonUtil.toJson(requestBody(systemPrompt, userPrompt, jsonMode));
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(trimSlash(config.getBaseUrl()) + "/chat/completions"))
                .timeout(config.getTimeout())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new DialogueEngineException(DialogueEngineErrorCode.LLM_TIMEOUT,
                    "LLM call timed out after " + config.getTimeout(), e);
        } catch (IOException e) {
            throw new DialogueEngineException(DialogueEngineErrorCode.LLM_CALL_FAILED,
                    "LLM call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DialogueEngineException(DialogueEngineErrorCode.LLM_CALL_FAILED, "LLM call interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new DialogueEngineException(DialogueEngineErrorCode.LLM_CALL_FAILED,
                    "LLM call failed with status " + response.statusCode())
                    .withMetaData(Map.of("status", response.statusCode(), "model", String.valueOf(config.getModel())));
        }
        String content = readContent(response.body());
        if (content == null || content.isBlank()) {
            throw new DialogueEngineException(DialogueEngineErrorCode.LLM_EMPTY_RESPONSE);
        }
        log.debug("LLM completion received model={} chars={}", config.getModel(), content.length());
        return content.trim();
    }

    private ObjectNode requestBody(String systemPrompt, String userPrompt, boolean jsonMode) {
        ObjectNode root = JsonUtil.object();
        root.put("model", config.getModel());
        root.put("temperature", config.getTemperature());
        root.put("max_tokens", config.getMaxTokens());
        ArrayNode messages = root.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        messages.addObject().put("role", "user").put("content", userPrompt == null ? "" : userPrompt);
        if (jsonMode) {
            root.putObject("response_format").put("type", "json_object");
        }
        return root;
    }

    static String readContent(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            Object content = JsonPath.read(body, CONTENT_PATH);
            return content == null ? null : String.valueOf(content);
        } catch (PathNotFoundException e) {
            throw new DialogueEngineException(DialogueEngineErrorCode.LLM_EMPTY_RESPONSE,
                    "LLM response has no message content", e);
        }
    }

    private static String trimSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
