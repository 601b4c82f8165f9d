package com.delta.harvester.crawl.capture;

import com.delta.harvester.crawl.extract.CategoryVocabulary;
import com.delta.harvester.crawl.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ListingTextParser {
    private static final int MAX_NAME_LENGTH = 50;
    private static final int FALLBACK_NAME_WORDS = 3;

    public ListingBasicInfo parse(String text) {
        if (text == null || text.isBlank()) {
            return new ListingBasicInfo("", List.of());
        }
        String name = "";
        for (String line : text.split("[\\r\\n]+")) {
            if (!line.isBlank()) {
                name = TextNormalizer.collapseWhitespace(line);
                break;
            }
        }
        if (name.length() > MAX_NAME_LENGTH) {
            String[] words = name.split(" ");
            name = String.join(" ", List.of(words).subList(0, Math.min(FALLBACK_NAME_WORDS, words.length)));
        }
        return new ListingBasicInfo(name, CategoryVocabulary.findIn(text));
    }

    public record ListingBasicInfo(String name, List<String> categories) {}
}
