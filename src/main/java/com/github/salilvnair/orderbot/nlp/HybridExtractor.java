package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.model.ExtractionResult;
import com.github.salilvnair.orderbot.engine.model.ExtractionSource;
import com.github.salilvnair.orderbot.llm.fallback.FallbackIntent;
import com.github.salilvnair.orderbot.llm.fallback.FallbackProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Pattern matcher first, fallback provider second. Never throws.
 */
@Slf4j
@Component
public class HybridExtractor {

    public static final double DEFAULT_FALLBACK_CONFIDENCE = 0.5d;

    private final PatternMatcher patternMatcher;
    private final LanguageDetector languageDetector;
    private final ObjectProvider<FallbackProvider> fallbackProvider;

    public HybridExtractor(
            PatternMatcher patternMatcher,
            LanguageDetector languageDetector,
            ObjectProvider<FallbackProvider> fallbackProvider
    ) {
        this.patternMatcher = patternMatcher;
        this.languageDetector = languageDetector;
        this.fallbackProvider = fallbackProvider;
    }

    public ExtractionResult extract(String text) {
        String language = languageDetector.detect(text);
        try {
            Optional<ExtractionResult> matched = patternMatcher.match(text);
            if (matched.isPresent()) {
                return matched.get();
            }
        } catch (RuntimeException e) {
            log.warn("Pattern matching failed for text '{}': {}", text, e.getMessage(), e);
            return ExtractionResult.noMatch(language, ExtractionSource.ERROR);
        }

        FallbackProvider provider = fallbackProvider.getIfAvailable();
        if (provider == null) {
            return ExtractionResult.noMatch(language, ExtractionSource.NONE);
        }

        try {
            Optional<FallbackIntent> fallback = provider.extractIntent(text, language);
            if (fallback.isEmpty()) {
                return ExtractionResult.noMatch(language, ExtractionSource.FALLBACK);
            }
            FallbackIntent intent = fallback.get();
            String code = intent.intent();
            if (code == null || code.isBlank() || IntentCode.UNKNOWN.equalsIgnoreCase(code)) {
                code = null;
            }
            double confidence = intent.confidence() == null ? DEFAULT_FALLBACK_CONFIDENCE : intent.confidence();
            return new ExtractionResult(code, intent.entities(), language, ExtractionSource.FALLBACK, confidence, List.of());
        } catch (RuntimeException e) {
            log.warn("Fallback intent extraction failed for text '{}': {}", text, e.getMessage());
            return ExtractionResult.noMatch(language, ExtractionSource.ERROR);
        }
    }
}
