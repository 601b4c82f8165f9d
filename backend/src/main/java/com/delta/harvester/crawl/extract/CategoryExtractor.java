package com.delta.harvester.crawl.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class CategoryExtractor {
    static final String TAG_SELECTOR =
        ".pill, .tag, .badge, [class*=pill], [class*=tag], [class*=badge], a[href*='/industry/']";

    public List<String> extract(Document document) {
        Set<String> categories = new LinkedHashSet<>();
        for (Element element : document.select(TAG_SELECTOR)) {
            String canonical = CategoryVocabulary.canonical(element.text());
            if (canonical != null) {
                categories.add(canonical);
            }
        }
        return new ArrayList<>(categories);
    }
}
