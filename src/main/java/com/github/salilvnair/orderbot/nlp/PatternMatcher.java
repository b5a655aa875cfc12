package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.engine.constants.EntityKey;
import com.github.salilvnair.orderbot.engine.constants.IntentCode;
import com.github.salilvnair.orderbot.engine.model.BatchItem;
import com.github.salilvnair.orderbot.engine.model.ExtractionResult;
import com.github.salilvnair.orderbot.engine.model.ExtractionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Deterministic extractor. Detects the message language, then tries that language's rules
 * in table order; the first rule that matches decides the intent. Every hit has confidence 1.0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternMatcher {

    public static final double PATTERN_CONFIDENCE = 1.0d;

    private final PatternTable table;
    private final LanguageDetector languageDetector;
    private final ItemTextNormalizer normalizer;
    private final MultiItemParser multiItemParser;

    public Optional<ExtractionResult> match(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
        if (lower.isEmpty()) {
            return Optional.empty();
        }
        String language = languageDetector.detect(lower);

        for (PatternRule rule : table.rules(language)) {
            Matcher m = rule.pattern().matcher(lower);
            if (!m.find()) {
                continue;
            }
            Map<String, Object> entities = new LinkedHashMap<>();
            String fullInput = null;
            for (String group : rule.groups()) {
                String value = m.group(group);
                if (value == null || value.isBlank()) {
                    continue;
                }
                switch (group) {
                    case PatternTable.GROUP_FULL_INPUT -> fullInput = value.trim();
                    case PatternTable.GROUP_ORDER_ID -> entities.put(EntityKey.ORDER_ID, value.trim());
                    case PatternTable.GROUP_ITEM -> entities.put(EntityKey.ITEM, value.trim());
                    default -> entities.put(group, value.trim());
                }
            }
            log.debug("Pattern hit intent={} lang={} pattern={}", rule.intent(), language, rule.pattern().pattern());

            if (IntentCode.ADD_ITEM.equals(rule.intent()) && fullInput != null) {
                return Optional.of(addItem(fullInput, language, entities));
            }
            return Optional.of(result(rule.intent(), language, entities, List.of()));
        }
        return Optional.empty();
    }

    private ExtractionResult addItem(String fullInput, String language, Map<String, Object> entities) {
        if (multiItemParser.isMultiItem(fullInput)) {
            List<BatchItem> batch = multiItemParser.parse(fullInput, language);
            if (batch.size() >= 2) {
                return result(IntentCode.ADD_ITEM, language, entities, batch);
            }
        }

        String remaining = fullInput;
        Optional<ItemTextNormalizer.Quantified> quantified = normalizer.leadingQuantity(remaining, language);
        if (quantified.isPresent()) {
            entities.put(EntityKey.QUANTITY, quantified.get().quantity());
            remaining = quantified.get().remaining();
        }

        ItemTextNormalizer.Sized sized = normalizer.extractSize(remaining, language);
        String item = normalizer.cleanItemName(sized.remaining(), language);

        entities.put(EntityKey.ITEM, item);
        if (sized.size() != null) {
            entities.put(EntityKey.SIZE, sized.size());
        }
        return result(IntentCode.ADD_ITEM, language, entities, List.of());
    }

    private ExtractionResult result(String intent, String language, Map<String, Object> entities, List<BatchItem> batch) {
        return new ExtractionResult(intent, entities, language, ExtractionSource.PATTERN, PATTERN_CONFIDENCE, batch);
    }
}
