package com.delta.harvester.crawl.extract;

import com.delta.harvester.crawl.util.KeywordSet;
import com.delta.harvester.crawl.util.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class SummaryExtractor {
    static final String WHAT_THEY_DO = "What They Do: ";
    static final String SPECIFIC_INSIGHTS = "Specific Insights: ";
    static final String PART_SEPARATOR = " | ";

    static final String TEAM_SECTION_SELECTOR =
        ".team, .founders, .about-team, .leadership, [class*=founder], [class*=team]";
    private static final List<String> CONTENT_CONTAINERS = List.of("main", "article", ".content", "section");
    private static final int MIN_SECTION_TEXT = 30;
    private static final int MIN_CONTAINER_TEXT = 100;
    private static final int MIN_INSIGHT_LENGTH = 30;

    static final KeywordSet TEAM_KEYWORDS = KeywordSet.of(
        "founded by", "co-founder", "former", "ex-", "previously at", "worked at", "experience at",
        "stanford", "mit", "harvard", "berkeley", "phd", "google", "facebook", "microsoft", "apple",
        "amazon", "tesla"
    );
    static final KeywordSet TRACTION_KEYWORDS = KeywordSet.of(
        "customers", "users", "revenue", "growth", "funding", "raised", "series a", "series b", "seed",
        "million", "billion", "partnership", "enterprise", "fortune 500"
    );
    static final KeywordSet UNIQUE_KEYWORDS = KeywordSet.of(
        "first", "only", "unique", "breakthrough", "proprietary", "patent", "innovative", "revolutionary",
        "cutting-edge", "novel", "10x", "100x", "faster", "better", "advanced"
    );
    private static final KeywordSet BOILERPLATE = KeywordSet.of(
        "y combinator", "yc", "founded in", "based in", "employees", "home >", "companies >", "back to"
    );

    public String extract(Document document, String description) {
        List<String> parts = new ArrayList<>();
        if (description != null && !description.isBlank()) {
            parts.add(WHAT_THEY_DO + description.trim());
        }

        Set<String> used = new LinkedHashSet<>();
        List<String> contentSentences = SentenceSplitter.split(mainContentText(document));
        String team = firstMatching(SentenceSplitter.split(teamSectionText(document)), TEAM_KEYWORDS, used);
        if (team.isEmpty()) {
            team = firstMatching(contentSentences, TEAM_KEYWORDS, used);
        }
        firstMatching(contentSentences, TRACTION_KEYWORDS, used);
        firstMatching(contentSentences, UNIQUE_KEYWORDS, used);

        if (!used.isEmpty()) {
            List<String> insights = new ArrayList<>();
            for (String sentence : used) {
                insights.add(TextNormalizer.cleanSentence(sentence));
            }
            parts.add(SPECIFIC_INSIGHTS + String.join(" ", insights));
        }
        return String.join(PART_SEPARATOR, parts);
    }

    private String firstMatching(List<String> sentences, KeywordSet keywords, Set<String> used) {
        for (String sentence : sentences) {
            if (sentence.length() <= MIN_INSIGHT_LENGTH || used.contains(sentence)) {
                continue;
            }
            if (BOILERPLATE.matchesAny(sentence) || !keywords.matchesAny(sentence)) {
                continue;
            }
            used.add(sentence);
            return sentence;
        }
        return "";
    }

    private String teamSectionText(Document document) {
        Set<String> texts = new LinkedHashSet<>();
        for (Element section : document.select(TEAM_SECTION_SELECTOR)) {
            String text = TextNormalizer.collapseWhitespace(section.text());
            if (text.length() > MIN_SECTION_TEXT) {
                texts.add(text);
            }
        }
        return String.join(" ", texts);
    }

    private String mainContentText(Document document) {
        Set<String> texts = new LinkedHashSet<>();
        for (String selector : CONTENT_CONTAINERS) {
            for (Element container : document.select(selector)) {
                String text = TextNormalizer.collapseWhitespace(container.text());
                if (text.length() > MIN_CONTAINER_TEXT) {
                    texts.add(text);
                }
            }
        }
        if (texts.isEmpty() && document.body() != null) {
            texts.add(TextNormalizer.collapseWhitespace(document.body().text()));
        }
        return String.join(" ", texts);
    }
}
