package com.delta.harvester.crawl.util;

import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern URL = Pattern.compile("https?://\\S+");

    private TextNormalizer() {
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    public static String cleanSentence(String value) {
        String sentence = collapseWhitespace(value);
        if (sentence.isEmpty()) {
            return sentence;
        }
        char last = sentence.charAt(sentence.length() - 1);
        if (last != '.' && last != '!' && last != '?') {
            sentence = sentence + ".";
        }
        return sentence;
    }

    public static String stripUrls(String value) {
        if (value == null) {
            return "";
        }
        return collapseWhitespace(URL.matcher(value).replaceAll(" "));
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength).trim();
    }
}
