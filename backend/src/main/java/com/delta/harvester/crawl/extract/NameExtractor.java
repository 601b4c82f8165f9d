package com.delta.harvester.crawl.extract;

import com.delta.harvester.crawl.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class NameExtractor {
    static final int MAX_NAMES = 5;

    private static final Set<String> EXCLUDED_WORDS = Set.of(
        "the", "and", "or", "but", "for", "with", "from", "to", "in", "on", "at",
        "founder", "co-founder", "ceo", "cto", "coo", "chief", "engineer", "officer",
        "president", "director", "manager", "lead", "senior", "junior",
        "company", "linkedin", "profile", "previously", "currently", "formerly",
        "y", "combinator", "summer", "winter", "spring", "fall"
    );
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");
    private static final List<String> ROLE_FRAGMENTS = List.of("founder", "engineer", "officer", "director", "manager");

    public List<String> findNames(String text) {
        String normalized = TextNormalizer.collapseWhitespace(text);
        if (normalized.isEmpty()) {
            return List.of();
        }
        String[] words = normalized.split(" ");
        for (int w = 0; w < words.length; w++) {
            words[w] = EDGE_PUNCTUATION.matcher(words[w]).replaceAll("");
        }
        Set<String> names = new LinkedHashSet<>();
        int i = 0;
        while (i < words.length && names.size() < MAX_NAMES) {
            if (!isNameToken(words[i], true)) {
                i++;
                continue;
            }
            if (i + 1 < words.length && isNameToken(words[i + 1], false)) {
                String candidate = words[i] + " " + words[i + 1];
                if (!containsRoleFragment(candidate)) {
                    names.add(candidate);
                }
                i += 2;
            } else {
                i++;
            }
        }
        return new ArrayList<>(names);
    }

    private boolean isNameToken(String word, boolean first) {
        if (word.length() < 2 || !Character.isUpperCase(word.charAt(0))) {
            return false;
        }
        if (EXCLUDED_WORDS.contains(word.toLowerCase(Locale.ROOT)) || isDigits(word)) {
            return false;
        }
        return !first || !word.startsWith("http");
    }

    private boolean containsRoleFragment(String candidate) {
        String lower = candidate.toLowerCase(Locale.ROOT);
        for (String fragment : ROLE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private boolean isDigits(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
