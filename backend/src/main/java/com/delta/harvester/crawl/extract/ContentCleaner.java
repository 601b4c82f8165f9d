package com.delta.harvester.crawl.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Set;

public final class ContentCleaner {
    static final String CHROME_SELECTOR = "nav, .nav, .navigation, .breadcrumb, .breadcrumbs, header, footer";
    private static final Set<String> CHROME_TEXTS = Set.of(
        "home", "companies", "home > companies", ">", "back to companies"
    );

    private ContentCleaner() {
    }

    public static Document withoutChrome(Document document) {
        Document copy = document.clone();
        copy.select(CHROME_SELECTOR).remove();
        for (Element element : copy.body().select("a, span, li, div")) {
            if (element.parent() == null || !element.children().isEmpty()) {
                continue;
            }
            String text = element.text().trim().toLowerCase(Locale.ROOT);
            if (CHROME_TEXTS.contains(text)) {
                element.remove();
            }
        }
        return copy;
    }
}
