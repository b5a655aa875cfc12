package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.util.NumberParsing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quantity, size and filler-word normalization of free item text, e.g.
 * "2 large the margherita pizza" to (2, L, "margherita pizza").
 */
@Component
@RequiredArgsConstructor
public class ItemTextNormalizer {

    private static final Pattern LEADING_NUMERAL = Pattern.compile("^(\\d+)\\s*(\\p{L}.*)$", PatternTable.FLAGS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final PatternTable table;

    public record Quantified(int quantity, String remaining) {}

    public record Sized(String size, String remaining) {}

    /** "one cola" gives (1, "cola"). */
    public Optional<Quantified> leadingWordNumber(String text, String language) {
        List<String> words = words(text);
        if (words.isEmpty()) {
            return Optional.empty();
        }
        Integer quantity = table.wordNumbers(language).get(words.get(0));
        if (quantity == null) {
            return Optional.empty();
        }
        return Optional.of(new Quantified(quantity, String.join(" ", words.subList(1, words.size()))));
    }

    /** "2cola" and "2 cola" give (2, "cola"). */
    public Optional<Quantified> leadingNumeral(String text) {
        Matcher m = LEADING_NUMERAL.matcher(text == null ? "" : text.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Quantified(NumberParsing.saturatedInt(m.group(1)), m.group(2).trim()));
    }

    /** Leading word-number, then leading numeral. */
    public Optional<Quantified> leadingQuantity(String text, String language) {
        Optional<Quantified> word = leadingWordNumber(text, language);
        return word.isPresent() ? word : leadingNumeral(text);
    }

    /**
     * First size code whose pattern occurs in the text, with every occurrence of that
     * pattern removed. The size is null when none occurs.
     */
    public Sized extractSize(String text, String language) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
        for (Map.Entry<String, Pattern> entry : table.sizePatterns(language).entrySet()) {
            Matcher m = entry.getValue().matcher(lower);
            if (m.find()) {
                String cleaned = m.replaceAll("").trim();
                return new Sized(entry.getKey(), WHITESPACE.matcher(cleaned).replaceAll(" "));
            }
        }
        return new Sized(null, lower);
    }

    /** "a sea ranch pizza" gives "sea ranch pizza". Only leading fillers are stripped. */
    public String cleanItemName(String text, String language) {
        List<String> words = new ArrayList<>(words(text));
        List<String> fillers = table.fillerWords(language);
        while (!words.isEmpty() && fillers.contains(words.get(0))) {
            words.remove(0);
        }
        return String.join(" ", words).trim();
    }

    private List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(text.trim().toLowerCase(Locale.ROOT)));
    }
}
