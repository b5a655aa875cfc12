package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.model.ExtractionResult;
import com.github.salilvnair.orderbot.engine.model.ExtractionSource;
import com.github.salilvnair.orderbot.llm.fallback.FallbackIntent;
import com.github.salilvnair.orderbot.llm.fallback.FallbackProvider;
import com.github.salilvnair.orderbot.support.OrderBotHarness;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HybridExtractorTest {

    private final PatternTable table = new PatternTable();
    private final LanguageDetector detector = new LanguageDetector();
    private final ItemTextNormalizer normalizer = new ItemTextNormalizer(table);
    private final PatternMatcher matcher =
            new PatternMatcher(table, detector, normalizer, new MultiItemParser(normalizer));

    @Test
    void patternHitNeverConsultsFallback() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        HybridExtractor extractor = extractor(fallback);

        ExtractionResult result = extractor.extract(TEXT_SHOW_CART);

        assertEquals(IntentCode.VIEW_CART, result.intent());
        assertEquals(ExtractionSource.PATTERN, result.source());
        verifyNoInteractions(fallback);
    }

    @Test
    void noMatchWithoutFallbackProvider() {
        ExtractionResult result = extractor(null).extract(TEXT_GIBBERISH);

        assertNull(result.intent());
        assertEquals(ExtractionSource.NONE, result.source());
        assertEquals(0.0d, result.confidence());
    }

    @Test
    void fallbackIntentUsesDefaultConfidence() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        when(fallback.extractIntent(anyString(), anyString())).thenReturn(Optional.of(
                new FallbackIntent(IntentCode.ADD_ITEM, Map.of(EntityKey.ITEM, "cola"), null)));

        ExtractionResult result = extractor(fallback).extract(TEXT_GIBBERISH);

        assertEquals(IntentCode.ADD_ITEM, result.intent());
        assertEquals("cola", result.entities().get(EntityKey.ITEM));
        assertEquals(ExtractionSource.FALLBACK, result.source());
        assertEquals(HybridExtractor.DEFAULT_FALLBACK_CONFIDENCE, result.confidence());
    }

    @Test
    void unknownFallbackIntentBecomesNull() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        when(fallback.extractIntent(anyString(), anyString())).thenReturn(Optional.of(
                new FallbackIntent(IntentCode.UNKNOWN, Map.of(), 0.3d)));

        ExtractionResult result = extractor(fallback).extract(TEXT_GIBBERISH);

        assertNull(result.intent());
        assertEquals(ExtractionSource.FALLBACK, result.source());
        assertEquals(0.3d, result.confidence());
    }

    @Test
    void fallbackFailureIsReportedAsError() {
        FallbackProvider fallback = mock(FallbackProvider.class);
        when(fallback.extractIntent(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        ExtractionResult result = extractor(fallback).extract(TEXT_GIBBERISH);

        assertNull(result.intent());
        assertEquals(ExtractionSource.ERROR, result.source());
    }

    private HybridExtractor extractor(FallbackProvider fallback) {
        return new HybridExtractor(matcher, detector, OrderBotHarness.provider(FallbackProvider.class, fallback));
    }
}
