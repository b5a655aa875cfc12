package com.github.salilvnair.orderbot.llm.fallback;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.llm.core.LlmClient;
import com.github.salilvnair.orderbot.template.ThymeleafTemplateRenderer;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class LlmFallbackProviderTest {

    private final LlmClient llmClient = mock(LlmClient.class);
    private final LlmFallbackProvider provider = new LlmFallbackProvider(llmClient, new ThymeleafTemplateRenderer());

    @Test
    void parsesJsonAndDropsUnknownEntityKeys() {
        FallbackIntent intent = provider.parseIntent(
                "{\"intent\":\"ADD_ITEM\",\"entities\":{\"item\":\"cola\",\"colour\":\"red\"},\"confidence\":0.8}")
                .orElseThrow();

        assertEquals(IntentCode.ADD_ITEM, intent.intent());
        assertEquals(Map.of(EntityKey.ITEM, "cola"), intent.entities());
        assertEquals(0.8d, intent.confidence());
    }

    @Test
    void parsesFencedJson() {
        FallbackIntent intent = provider.parseIntent("Sure!\n```json\n{\"intent\":\"view_cart\",\"entities\":{}}\n```")
                .orElseThrow();

        assertEquals(IntentCode.VIEW_CART, intent.intent());
        assertNull(intent.confidence());
    }

    @Test
    void acceptsBareIntentWord() {
        assertEquals(IntentCode.CHECKOUT, provider.parseIntent("checkout").orElseThrow().intent());
        assertTrue(provider.parseIntent("dance").isEmpty());
        assertTrue(provider.parseIntent("I have no idea what you mean").isEmpty());
    }

    @Test
    void unsupportedIntentInJsonBecomesNull() {
        assertNull(provider.parseIntent("{\"intent\":\"order_drone\"}").orElseThrow().intent());
    }

    @Test
    void extractIntentRendersPromptWithQuery() {
        when(llmClient.generateJson(isNull(), anyString())).thenReturn("{\"intent\":\"browse_menu\"}");

        Optional<FallbackIntent> intent = provider.extractIntent(TEXT_GIBBERISH, LanguageCode.EN);

        assertEquals(IntentCode.BROWSE_MENU, intent.orElseThrow().intent());
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generateJson(isNull(), prompt.capture());
        assertTrue(prompt.getValue().contains("User query: " + TEXT_GIBBERISH));
        assertTrue(prompt.getValue().contains("- add_item: add items to cart"));
    }

    @Test
    void clientFailureGivesEmptyResult() {
        when(llmClient.generateJson(isNull(), anyString()))
                .thenThrow(new DialogueEngineException(DialogueEngineErrorCode.LLM_TIMEOUT));

        assertTrue(provider.extractIntent(TEXT_GIBBERISH, LanguageCode.EN).isEmpty());
    }

    @Test
    void generatedReplyIsTrimmedAndBlankIsEmpty() {
        when(llmClient.generateText(isNull(), anyString())).thenReturn("  " + GENERATED_REPLY + "\n", "   ");

        assertEquals(Optional.of(GENERATED_REPLY), provider.generateReply(TEXT_GIBBERISH, "ctx", LanguageCode.EN));
        assertTrue(provider.generateReply(TEXT_GIBBERISH, "ctx", LanguageCode.EN).isEmpty());
    }
}
