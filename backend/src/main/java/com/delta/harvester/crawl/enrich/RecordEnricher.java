package com.delta.harvester.crawl.enrich;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.crawl.browser.BrowserSession;
import com.delta.harvester.crawl.browser.NavigationException;
import com.delta.harvester.crawl.extract.DetailPageExtractor;
import com.delta.harvester.crawl.model.CompanyRecord;
import com.delta.harvester.crawl.model.EnrichedFields;
import com.delta.harvester.crawl.model.EnrichmentError;
import com.delta.harvester.crawl.model.EnrichmentResult;
import com.delta.harvester.crawl.util.EnrichmentReasonCodes;
import com.delta.harvester.crawl.util.Pauses;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class RecordEnricher {
    private static final Logger log = LoggerFactory.getLogger(RecordEnricher.class);

    private final DetailPageExtractor detailPageExtractor;

    public RecordEnricher(DetailPageExtractor detailPageExtractor) {
        this.detailPageExtractor = detailPageExtractor;
    }

    public EnrichmentResult enrich(BrowserSession session, CompanyRecord record, HarvesterProperties.Enrichment settings) {
        String url = record.identityKey();
        EnrichedFields.Builder fields = EnrichedFields.builder();
        try {
            session.navigate(url, Duration.ofMillis(settings.getCompanyPageTimeoutMs()));
        } catch (NavigationException e) {
            String reason = EnrichmentReasonCodes.fromException(e);
            log.warn("Navigation to {} failed ({}): {}", url, reason, e.getMessage());
            return EnrichmentResult.failure(url, new EnrichmentError(reason, e.getMessage(), fields.build()));
        } catch (RuntimeException e) {
            log.warn("Navigation to {} failed unexpectedly", url, e);
            return EnrichmentResult.failure(
                url,
                new EnrichmentError(EnrichmentReasonCodes.NAVIGATION_FAILED, String.valueOf(e.getMessage()), fields.build())
            );
        }

        if (!Pauses.pause(settings.getPageSettleDelayMs())) {
            return EnrichmentResult.failure(
                url,
                new EnrichmentError(EnrichmentReasonCodes.INTERRUPTED, "Interrupted while waiting for " + url, fields.build())
            );
        }

        try {
            String html = session.content();
            if (html == null || html.isBlank()) {
                return EnrichmentResult.failure(
                    url,
                    new EnrichmentError(EnrichmentReasonCodes.EMPTY_CONTENT, "Empty page content for " + url, fields.build())
                );
            }
            Document document = Jsoup.parse(html, url);
            detailPageExtractor.extract(document, record.name(), fields);
            return EnrichmentResult.success(url, fields.build());
        } catch (RuntimeException e) {
            log.warn("Failed to extract details from {}", url, e);
            return EnrichmentResult.failure(
                url,
                new EnrichmentError(EnrichmentReasonCodes.PARSING_FAILED, String.valueOf(e.getMessage()), fields.build())
            );
        }
    }
}
