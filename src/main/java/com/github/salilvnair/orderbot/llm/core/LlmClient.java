package com.github.salilvnair.orderbot.llm.core;

public interface LlmClient {

    /** Free-form completion for a fully rendered prompt. */
    String generateText(String systemPrompt, String userPrompt);

    default String generateJson(String systemPrompt, String userPrompt) {
        // providers without a JSON response mode fall back to plain text
        return generateText(systemPrompt, userPrompt);
    }
}
