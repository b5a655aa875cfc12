package com.github.salilvnair.orderbot.nlp;

import com.github.salilvnair.orderbot.engine.constants.LanguageCode;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class LanguageDetector {

    private static final Pattern ARABIC_SCRIPT = Pattern.compile("[\\u0600-\\u06FF]");

    public String detect(String text) {
        if (text != null && ARABIC_SCRIPT.matcher(text).find()) {
            return LanguageCode.AR;
        }
        return LanguageCode.EN;
    }
}
