package com.delta.harvester.crawl.extract;

import com.delta.harvester.crawl.model.EnrichedFields;
import com.delta.harvester.crawl.util.TextNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

@Component
public class DetailPageExtractor {
    private final DescriptionExtractor descriptionExtractor;
    private final FounderExtractor founderExtractor;
    private final SummaryExtractor summaryExtractor;
    private final CategoryExtractor categoryExtractor;

    public DetailPageExtractor(
        DescriptionExtractor descriptionExtractor,
        FounderExtractor founderExtractor,
        SummaryExtractor summaryExtractor,
        CategoryExtractor categoryExtractor
    ) {
        this.descriptionExtractor = descriptionExtractor;
        this.founderExtractor = founderExtractor;
        this.summaryExtractor = summaryExtractor;
        this.categoryExtractor = categoryExtractor;
    }

    public void extract(Document document, String listingName, EnrichedFields.Builder into) {
        Element heading = document.selectFirst("h1");
        if (heading != null) {
            into.name(TextNormalizer.collapseWhitespace(heading.text()));
        }

        Document content = ContentCleaner.withoutChrome(document);
        String description = descriptionExtractor.extract(content, listingName);
        into.description(description);
        into.founders(founderExtractor.extract(document));
        into.categories(categoryExtractor.extract(document));
        into.summary(summaryExtractor.extract(content, description));
    }
}
