package com.github.salilvnair.orderbot.template;

import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.llm.fallback.LlmFallbackProvider;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.orderbot.support.TestConstants.TEXT_ADD_PIZZA;
import static org.junit.jupiter.api.Assertions.*;

class ThymeleafTemplateRendererTest {

    private final ThymeleafTemplateRenderer renderer = new ThymeleafTemplateRenderer();

    @Test
    void rendersDoubleBraceVariables() {
        String rendered = renderer.render("User: {{query}}", Map.of("query", TEXT_ADD_PIZZA));

        assertEquals("User: " + TEXT_ADD_PIZZA, rendered);
    }

    @Test
    void rendersNativeInlinedExpressions() {
        String rendered = renderer.render("Lang: [(${language})]", Map.of("language", "ar"));

        assertEquals("Lang: ar", rendered);
    }

    @Test
    void preservesSpecialCharactersInResolvedValues() {
        String value = "total$140 {EGP}\\path";

        assertEquals("Value: " + value, renderer.render("Value: {{v}}", Map.of("v", value)));
    }

    @Test
    void extractPromptListsIntentsAndQuery() {
        Map<String, String> intents = new LinkedHashMap<>();
        intents.put("view_cart", "show cart");
        intents.put("checkout", "place/confirm order");
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("intents", intents);
        vars.put("entityKeys", List.of("item", "size"));
        vars.put("language", "en");
        vars.put("query", TEXT_ADD_PIZZA);

        String prompt = renderer.renderResource(LlmFallbackProvider.EXTRACT_PROMPT, vars);

        assertTrue(prompt.contains("- view_cart: show cart"));
        assertTrue(prompt.contains("- checkout: place/confirm order"));
        assertTrue(prompt.contains("Entities: item, size"));
        assertTrue(prompt.contains("User query: " + TEXT_ADD_PIZZA));
    }

    @Test
    void missingResourceFails() {
        assertThrows(DialogueEngineException.class, () -> renderer.renderResource("prompts/missing.txt", Map.of()));
    }

    @Test
    void blankTemplateIsReturnedAsIs() {
        assertEquals("", renderer.render(null, Map.of()));
    }
}
