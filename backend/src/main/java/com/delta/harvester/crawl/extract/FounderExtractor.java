package com.delta.harvester.crawl.extract;

import com.delta.harvester.crawl.model.Founder;
import com.delta.harvester.crawl.util.KeywordSet;
import com.delta.harvester.crawl.util.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Extracts founders and their LinkedIn profile URLs from a company detail page.
 *
 * <p>Strategies, each used only when the previous one found nobody:
 * <ol>
 *   <li>person-profile anchors inside founder or team sections</li>
 *   <li>person-profile anchors anywhere on the page</li>
 *   <li>names near founder keywords, without profile URLs</li>
 * </ol>
 * Profile links are read from the page only; LinkedIn itself is never visited.
 */
@Component
public class FounderExtractor {
    static final String SECTION_SELECTOR =
        ".founder, .team-member, .people, .leadership, [class*=founder], [class*=team]";
    static final String PROFILE_ANCHOR_SELECTOR = "a[href*='linkedin.com']";
    static final int SECTION_ANCESTOR_DEPTH = 3;
    static final int PAGE_ANCESTOR_DEPTH = 4;
    static final int KEYWORD_WINDOW_CHARS = 200;

    private static final Pattern QUERY_OR_FRAGMENT = Pattern.compile("[?#].*$");

    private static final KeywordSet FOUNDER_KEYWORDS = KeywordSet.of(
        "founder", "co-founder", "founders", "ceo", "cto", "coo", "team", "leadership", "about us", "our story"
    );

    private final NameExtractor nameExtractor;

    public FounderExtractor(NameExtractor nameExtractor) {
        this.nameExtractor = nameExtractor;
    }

    public List<Founder> extract(Document document) {
        Map<String, Founder> founders = new LinkedHashMap<>();
        for (Element section : document.select(SECTION_SELECTOR)) {
            collectProfileAnchors(section, SECTION_ANCESTOR_DEPTH, founders);
        }
        if (founders.isEmpty()) {
            collectProfileAnchors(document, PAGE_ANCESTOR_DEPTH, founders);
        }
        if (founders.isEmpty()) {
            collectNamesNearKeywords(document, founders);
        }
        List<Founder> out = new ArrayList<>(founders.values());
        return out.size() > NameExtractor.MAX_NAMES ? out.subList(0, NameExtractor.MAX_NAMES) : out;
    }

    private void collectProfileAnchors(Element scope, int ancestorDepth, Map<String, Founder> founders) {
        for (Element anchor : scope.select(PROFILE_ANCHOR_SELECTOR)) {
            String profileUrl = normalizeProfileUrl(anchor.attr("href"));
            if (!isPersonProfile(profileUrl)) {
                continue;
            }
            String name = anchorName(anchor, ancestorDepth);
            if (name.isEmpty()) {
                continue;
            }
            Founder founder = new Founder(name, profileUrl);
            founders.putIfAbsent(founder.dedupKey(), founder);
        }
    }

    private String anchorName(Element anchor, int ancestorDepth) {
        String own = TextNormalizer.collapseWhitespace(anchor.text());
        if (own.length() > 1 && !own.toLowerCase(Locale.ROOT).startsWith("linkedin")) {
            return own;
        }
        Element current = anchor;
        for (int level = 0; level < ancestorDepth; level++) {
            current = current.parent();
            if (current == null) {
                break;
            }
            List<String> names = nameExtractor.findNames(TextNormalizer.stripUrls(current.text()));
            if (!names.isEmpty()) {
                return names.get(0);
            }
        }
        return "";
    }

    private void collectNamesNearKeywords(Document document, Map<String, Founder> founders) {
        String text = TextNormalizer.collapseWhitespace(document.body() == null ? document.text() : document.body().text());
        if (!FOUNDER_KEYWORDS.matchesAny(text)) {
            return;
        }
        for (String window : keywordWindows(text)) {
            for (String name : nameExtractor.findNames(window)) {
                Founder founder = Founder.nameOnly(name);
                founders.putIfAbsent(founder.dedupKey(), founder);
                if (founders.size() >= NameExtractor.MAX_NAMES) {
                    return;
                }
            }
        }
    }

    private List<String> keywordWindows(String text) {
        List<String> windows = new ArrayList<>();
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : FOUNDER_KEYWORDS.keywords()) {
            int from = 0;
            int idx;
            while ((idx = lower.indexOf(keyword, from)) >= 0) {
                int start = Math.max(0, idx - KEYWORD_WINDOW_CHARS);
                int end = Math.min(text.length(), idx + keyword.length() + KEYWORD_WINDOW_CHARS);
                windows.add(text.substring(start, end));
                from = idx + keyword.length();
            }
        }
        return windows;
    }

    static boolean isPersonProfile(String profileUrl) {
        if (profileUrl.isEmpty() || !profileUrl.contains("linkedin.com")) {
            return false;
        }
        if (profileUrl.contains("/company/")) {
            return false;
        }
        return profileUrl.contains("/in/") || profileUrl.contains("/pub/");
    }

    /**
     * Canonical form used for deduplication: https, {@code www.linkedin.com}, no query,
     * fragment or trailing slash, lowercased.
     */
    public static String normalizeProfileUrl(String href) {
        if (href == null || href.isBlank()) {
            return "";
        }
        String url = href.trim();
        if (url.startsWith("//")) {
            url = "https:" + url;
        } else if (!url.toLowerCase(Locale.ROOT).startsWith("http")) {
            url = "https://" + url.replaceFirst("^/+", "");
        }
        url = url.replaceFirst("(?i)^http://", "https://");
        url = QUERY_OR_FRAGMENT.matcher(url).replaceFirst("");
        url = url.replaceFirst("/+$", "");
        url = url.toLowerCase(Locale.ROOT);
        if (url.startsWith("https://linkedin.com")) {
            url = "https://www." + url.substring("https://".length());
        }
        return url;
    }
}
