package com.github.salilvnair.orderbot.engine.constants;

public final class LanguageCode {

    private LanguageCode() {
    }

    public static final String EN = "en";
    public static final String AR = "ar";

    public static boolean isArabic(String language) {
        return AR.equals(language);
    }
}
