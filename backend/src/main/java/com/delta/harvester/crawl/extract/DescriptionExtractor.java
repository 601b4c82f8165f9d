package com.delta.harvester.crawl.extract;

import com.delta.harvester.crawl.util.KeywordSet;
import com.delta.harvester.crawl.util.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class DescriptionExtractor {
    static final int MAX_LENGTH = 500;
    static final int MIN_META_LENGTH = 30;
    static final int MIN_PARAGRAPH_LENGTH = 50;

    static final KeywordSet ACTION_VERBS = KeywordSet.of(
        "builds", "creates", "develops", "provides", "offers", "helps", "enables"
    );
    static final KeywordSet BUSINESS_NOUNS = KeywordSet.of(
        "platform", "software", "ai", "solution", "service", "tool", "system"
    );
    private static final KeywordSet PARAGRAPH_SKIP = KeywordSet.of(
        "home >", "companies >", "back to", "y combinator", "founded in", "employees based",
        "san francisco", "new york"
    );
    private static final KeywordSet SCORE_PENALTY = KeywordSet.of(
        "founded in", "based in", "employees", "y combinator", "yc"
    );
    private static final List<String> CONTENT_CONTAINERS = List.of("main", "article", ".content", "section");

    public String extract(Document document, String companyName) {
        String fromMeta = fromMeta(document);
        if (!fromMeta.isEmpty()) {
            return finish(fromMeta);
        }
        for (String selector : CONTENT_CONTAINERS) {
            Element container = document.selectFirst(selector);
            if (container == null) {
                continue;
            }
            for (Element paragraph : container.select("p")) {
                String text = TextNormalizer.collapseWhitespace(paragraph.text());
                if (isDescriptionParagraph(text)) {
                    return finish(text);
                }
            }
        }
        return finish(bestScoredParagraph(document, companyName));
    }

    private String fromMeta(Document document) {
        Element meta = document.selectFirst("meta[name=description]");
        if (meta == null) {
            return "";
        }
        String content = TextNormalizer.collapseWhitespace(meta.attr("content"));
        String lower = content.toLowerCase(Locale.ROOT);
        if (content.length() <= MIN_META_LENGTH || lower.startsWith("home") || lower.startsWith("companies")) {
            return "";
        }
        return content;
    }

    boolean isDescriptionParagraph(String text) {
        if (text.length() <= MIN_PARAGRAPH_LENGTH || PARAGRAPH_SKIP.matchesAny(text)) {
            return false;
        }
        return ACTION_VERBS.matchesAny(text) || BUSINESS_NOUNS.matchesAny(text);
    }

    private String bestScoredParagraph(Document document, String companyName) {
        String best = "";
        int bestScore = 0;
        for (Element paragraph : document.select("p")) {
            String text = TextNormalizer.collapseWhitespace(paragraph.text());
            if (text.length() <= MIN_PARAGRAPH_LENGTH) {
                continue;
            }
            int score = score(text, companyName);
            if (score <= 0) {
                continue;
            }
            if (score > bestScore || (score == bestScore && text.length() > best.length())) {
                best = text;
                bestScore = score;
            }
        }
        return best;
    }

    int score(String text, String companyName) {
        int score = 0;
        if (companyName != null && !companyName.isBlank()
            && text.toLowerCase(Locale.ROOT).contains(companyName.trim().toLowerCase(Locale.ROOT))) {
            score += 2;
        }
        if (ACTION_VERBS.matchesAny(text)) {
            score += 3;
        }
        score += BUSINESS_NOUNS.countDistinct(text);
        if (SCORE_PENALTY.matchesAny(text)) {
            score -= 2;
        }
        return score;
    }

    private String finish(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return TextNormalizer.truncate(TextNormalizer.cleanSentence(text), MAX_LENGTH);
    }
}
