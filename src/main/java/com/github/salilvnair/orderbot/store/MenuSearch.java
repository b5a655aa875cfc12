package com.github.salilvnair.orderbot.store;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Word splitting shared by {@link OrderingStore#searchMenu(String)} implementations.
 */
@UtilityClass
public final class MenuSearch {

    private static final int MIN_WORD_LENGTH = 3;

    public static List<String> searchWords(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(w -> w.length() >= MIN_WORD_LENGTH)
                .distinct()
                .toList();
    }

    public static boolean sharesWord(String name, List<String> words) {
        String lower = name.toLowerCase(Locale.ROOT);
        return words.stream().anyMatch(lower::contains);
    }
}
