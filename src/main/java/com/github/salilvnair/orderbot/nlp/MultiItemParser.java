package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.engine.model.BatchItem;
import com.github.salilvnair.orderbot.util.NumberParsing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one add-item text into several items.
 * <p>
 * "1fries 2cola", "1 fries 2 cola", "fries and cola" and "one fries, 2 cola" all give two items.
 */
@Component
@RequiredArgsConstructor
public class MultiItemParser {

    private static final Pattern DIGIT_PREFIXED = Pattern.compile("\\d+\\s*[a-z]");
    private static final Pattern SEPARATOR = Pattern.compile("\\band\\b|,");
    private static final Pattern NUMBER_ITEM_SCAN =
            Pattern.compile("(\\d+)\\s*([a-z]+(?:\\s+[a-z]+)*?)(?=\\s*\\d|$|\\s+and\\s+|,)");

    private final ItemTextNormalizer normalizer;

    public boolean isMultiItem(String text) {
        String lower = lower(text);
        Matcher m = DIGIT_PREFIXED.matcher(lower);
        int count = 0;
        while (m.find()) {
            count++;
        }
        if (count >= 2) {
            return true;
        }
        if (!SEPARATOR.matcher(lower).find()) {
            return false;
        }
        String[] parts = SEPARATOR.split(lower, -1);
        if (parts.length < 2) {
            return false;
        }
        for (String part : parts) {
            if (part.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Repeated "number + item" scan first; if that gives fewer than two items, a split on
     * "and"/comma. Returns an empty list when neither strategy applies.
     */
    public List<BatchItem> parse(String text, String language) {
        String lower = lower(text);

        List<BatchItem> scanned = scanNumberItems(lower, language);
        if (scanned.size() >= 2) {
            return scanned;
        }

        String[] parts = SEPARATOR.split(lower, -1);
        if (parts.length < 2) {
            return List.of();
        }
        List<BatchItem> items = new ArrayList<>();
        for (String raw : parts) {
            String part = raw.trim();
            if (part.isEmpty()) {
                continue;
            }
            int quantity = 1;
            String itemText = part;
            Optional<ItemTextNormalizer.Quantified> numeral = normalizer.leadingNumeral(part);
            if (numeral.isPresent()) {
                quantity = numeral.get().quantity();
                itemText = numeral.get().remaining();
            } else {
                Optional<ItemTextNormalizer.Quantified> word = normalizer.leadingWordNumber(part, language);
                if (word.isPresent()) {
                    quantity = word.get().quantity();
                    itemText = word.get().remaining();
                }
            }
            toItem(itemText, quantity, language).ifPresent(items::add);
        }
        return items;
    }

    private List<BatchItem> scanNumberItems(String text, String language) {
        List<MatchPair> pairs = new ArrayList<>();
        Matcher m = NUMBER_ITEM_SCAN.matcher(text);
        while (m.find()) {
            pairs.add(new MatchPair(NumberParsing.saturatedInt(m.group(1)), m.group(2).trim()));
        }
        if (pairs.size() < 2) {
            return List.of();
        }
        List<BatchItem> items = new ArrayList<>();
        for (MatchPair pair : pairs) {
            if (!pair.itemText().isEmpty()) {
                toItem(pair.itemText(), pair.quantity(), language).ifPresent(items::add);
            }
        }
        return items;
    }

    private Optional<BatchItem> toItem(String itemText, int quantity, String language) {
        ItemTextNormalizer.Sized sized = normalizer.extractSize(itemText, language);
        String name = normalizer.cleanItemName(sized.remaining(), language);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BatchItem(name, quantity, sized.size()));
    }

    private String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
    }

    private record MatchPair(int quantity, String itemText) {}
}
