package com.delta.harvester.crawl.extract;

import com.delta.harvester.crawl.util.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SentenceSplitter {
    static final int MIN_SENTENCE_LENGTH = 20;

    private static final List<String> ABBREVIATIONS = List.of(
        "Inc", "LLC", "Corp", "Ltd", "Co", "Dr", "Mr", "Ms", "Prof", "Sr", "Jr"
    );
    private static final String PERIOD_PLACEHOLDER = "__PERIOD__";
    private static final Pattern BOUNDARY = Pattern.compile("[.!?]\\s+(?=[A-Z])");
    private static final Pattern NAVIGATION_LIKE = Pattern.compile("^[A-Z][a-z]*\\s*[:|>].*");
    private static final List<String> NAVIGATION_PREFIXES = List.of("home", "companies", "back to");
    private static final List<Pattern> ABBREVIATION_PATTERNS = ABBREVIATIONS.stream()
        .map(abbreviation -> Pattern.compile("\\b" + abbreviation + "\\."))
        .toList();

    private SentenceSplitter() {
    }

    public static List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }
        String protectedText = text;
        for (int i = 0; i < ABBREVIATIONS.size(); i++) {
            protectedText = ABBREVIATION_PATTERNS.get(i).matcher(protectedText)
                .replaceAll(ABBREVIATIONS.get(i) + PERIOD_PLACEHOLDER);
        }
        for (String part : BOUNDARY.split(protectedText)) {
            String sentence = TextNormalizer.collapseWhitespace(part.replace(PERIOD_PLACEHOLDER, "."));
            if (sentence.length() <= MIN_SENTENCE_LENGTH) {
                continue;
            }
            String lower = sentence.toLowerCase(Locale.ROOT);
            if (NAVIGATION_PREFIXES.stream().anyMatch(lower::startsWith)) {
                continue;
            }
            if (NAVIGATION_LIKE.matcher(sentence).matches()) {
                continue;
            }
            sentences.add(sentence);
        }
        return sentences;
    }
}
