package com.github.salilvnair.orderbot.llm.core;

import com.github.salilvnair.orderbot.config.OrderBotProperties;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleLlmClientTest {

    @Test
    void readsFirstChoiceContent() {
        String body = "{\"id\":\"c1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"intent\\\":\\\"checkout\\\"}\"}}]}";

        assertEquals("{\"intent\":\"checkout\"}", OpenAiCompatibleLlmClient.readContent(body));
    }

    @Test
    void missingContentIsEmptyResponse() {
        DialogueEngineException ex = assertThrows(DialogueEngineException.class,
                () -> OpenAiCompatibleLlmClient.readContent("{\"choices\":[]}"));

        assertEquals(DialogueEngineErrorCode.LLM_EMPTY_RESPONSE.name(), ex.getErrorCode());
        assertNull(OpenAiCompatibleLlmClient.readContent(""));
    }

    @Test
    void unreachableEndpointIsCallFailure() {
        OrderBotProperties properties = new OrderBotProperties();
        properties.getLlm().setBaseUrl("http://127.0.0.1:1/v1/");
        properties.getLlm().setTimeout(Duration.ofSeconds(2));
        OpenAiCompatibleLlmClient client = new OpenAiCompatibleLlmClient(properties);

        DialogueEngineException ex = assertThrows(DialogueEngineException.class,
                () -> client.generateText(null, "hello"));

        assertTrue(ex.getErrorCode().equals(DialogueEngineErrorCode.LLM_CALL_FAILED.name())
                || ex.getErrorCode().equals(DialogueEngineErrorCode.LLM_TIMEOUT.name()));
    }
}
