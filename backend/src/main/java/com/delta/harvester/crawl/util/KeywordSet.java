package com.delta.harvester.crawl.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class KeywordSet {
    private final List<String> keywords;
    private final Pattern pattern;

    private KeywordSet(List<String> keywords) {
        this.keywords = List.copyOf(keywords);
        List<String> alternatives = new ArrayList<>();
        for (String keyword : keywords) {
            String lower = keyword.toLowerCase(Locale.ROOT);
            String left = Character.isLetterOrDigit(lower.charAt(0)) ? "\\b" : "";
            String right = Character.isLetterOrDigit(lower.charAt(lower.length() - 1)) ? "\\b" : "";
            alternatives.add(left + Pattern.quote(lower) + right);
        }
        this.pattern = Pattern.compile(String.join("|", alternatives), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public static KeywordSet of(String... keywords) {
        if (keywords.length == 0) {
            throw new IllegalArgumentException("KeywordSet needs at least one keyword");
        }
        return new KeywordSet(List.of(keywords));
    }

    public boolean matchesAny(String text) {
        return text != null && pattern.matcher(text).find();
    }

    public int countDistinct(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = pattern.matcher(text);
        List<String> seen = new ArrayList<>();
        while (matcher.find()) {
            String hit = matcher.group().toLowerCase(Locale.ROOT);
            if (!seen.contains(hit)) {
                seen.add(hit);
            }
        }
        return seen.size();
    }

    public List<String> keywords() {
        return keywords;
    }
}
