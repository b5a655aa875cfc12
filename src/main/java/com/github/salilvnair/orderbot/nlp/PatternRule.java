package com.github.salilvnair.orderbot.nlp;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of the intent table. {@code groups} lists the named capture groups the pattern declares.
 */
public record PatternRule(String intent, String language, Pattern pattern, List<String> groups) {}
