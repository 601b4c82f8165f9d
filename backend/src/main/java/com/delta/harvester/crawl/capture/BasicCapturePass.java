package com.delta.harvester.crawl.capture;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.crawl.checkpoint.CheckpointException;
import com.delta.harvester.crawl.checkpoint.CheckpointWriter;
import com.delta.harvester.crawl.model.CapturePassResult;
import com.delta.harvester.crawl.model.CompanyRecord;
import com.delta.harvester.crawl.model.ListingLink;
import com.delta.harvester.crawl.model.RecordSet;
import com.delta.harvester.crawl.model.RunContext;
import com.delta.harvester.crawl.model.SessionStats;
import com.delta.harvester.crawl.util.RecordUrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class BasicCapturePass {
    private static final Logger log = LoggerFactory.getLogger(BasicCapturePass.class);

    private final ListingTextParser listingTextParser;
    private final CheckpointWriter checkpointWriter;
    private final Clock clock;

    public BasicCapturePass(ListingTextParser listingTextParser, CheckpointWriter checkpointWriter, Clock clock) {
        this.listingTextParser = listingTextParser;
        this.checkpointWriter = checkpointWriter;
        this.clock = clock;
    }

    public CapturePassResult capture(List<ListingLink> links, RunContext context) {
        HarvesterProperties.Listing listing = context.properties().getListing();
        int saveInterval = context.properties().getCapture().getProgressSaveInterval();
        List<String> navigationLabels = listing.getNavigationLabels();
        RecordUrlNormalizer normalizer = RecordUrlNormalizer.forListing(listing);
        RecordSet records = context.records();
        SessionStats stats = context.stats();

        log.info("Pass 1: capturing basic data for {} links", links.size());
        int captured = 0;
        int skipped = 0;
        int duplicates = 0;
        int errors = 0;
        for (int i = 0; i < links.size(); i++) {
            ListingLink link = links.get(i);
            try {
                String label = link.text().trim().toLowerCase(Locale.ROOT);
                if (navigationLabels.contains(label)) {
                    log.debug("Skipping navigation link '{}'", link.text().trim());
                    skipped++;
                    stats.recordSkipped();
                    continue;
                }
                Optional<String> identity = normalizer.normalize(link.href());
                if (identity.isEmpty()) {
                    log.debug("Skipping non-record link {}", link.href());
                    skipped++;
                    stats.recordSkipped();
                    continue;
                }
                if (records.contains(identity.get())) {
                    duplicates++;
                    stats.recordDuplicate();
                    continue;
                }

                ListingTextParser.ListingBasicInfo info = listingTextParser.parse(link.text());
                Instant now = clock.instant();
                records.add(new CompanyRecord(identity.get(), info.name(), info.categories(), now));
                captured++;
                stats.recordProcessed();
                stats.recordCapture();
                log.info("Captured {}/{}: {}", i + 1, links.size(), info.name().isEmpty() ? identity.get() : info.name());

                if (captured % saveInterval == 0) {
                    saveProgress(context);
                }
            } catch (RuntimeException e) {
                errors++;
                stats.recordError();
                log.warn("Failed to capture link {}", link.href(), e);
            }
        }
        saveProgress(context);
        log.info(
            "Pass 1 complete: captured={} skipped={} duplicates={} errors={}",
            captured,
            skipped,
            duplicates,
            errors
        );
        return new CapturePassResult(captured, skipped, duplicates, errors);
    }

    private void saveProgress(RunContext context) {
        try {
            checkpointWriter.snapshot(context);
        } catch (CheckpointException e) {
            log.warn("Progress checkpoint failed for run {}", context.runId(), e);
        }
    }
}
