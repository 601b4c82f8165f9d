package com.delta.harvester.service;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.crawl.browser.BrowserSession;
import com.delta.harvester.crawl.browser.BrowserSessionFactory;
import com.delta.harvester.crawl.browser.NavigationException;
import com.delta.harvester.crawl.capture.BasicCapturePass;
import com.delta.harvester.crawl.checkpoint.CheckpointWriter;
import com.delta.harvester.crawl.discovery.ScrollConvergenceLoop;
import com.delta.harvester.crawl.enrich.EnrichmentPass;
import com.delta.harvester.crawl.model.CapturePassResult;
import com.delta.harvester.crawl.model.ConvergenceResult;
import com.delta.harvester.crawl.model.HarvestRunSummary;
import com.delta.harvester.crawl.model.RunContext;
import com.delta.harvester.crawl.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);

    static final double COMPLETENESS_WARNING_RATIO = 0.8;
    private static final String RUN_ID_PATTERN = "yyyyMMdd_HHmmss";

    private final HarvesterProperties properties;
    private final BrowserSessionFactory browserSessionFactory;
    private final ScrollConvergenceLoop scrollConvergenceLoop;
    private final BasicCapturePass basicCapturePass;
    private final EnrichmentPass enrichmentPass;
    private final CheckpointWriter checkpointWriter;
    private final Clock clock;

    public HarvestOrchestratorService(
        HarvesterProperties properties,
        BrowserSessionFactory browserSessionFactory,
        ScrollConvergenceLoop scrollConvergenceLoop,
        BasicCapturePass basicCapturePass,
        EnrichmentPass enrichmentPass,
        CheckpointWriter checkpointWriter,
        Clock clock
    ) {
        this.properties = properties;
        this.browserSessionFactory = browserSessionFactory;
        this.scrollConvergenceLoop = scrollConvergenceLoop;
        this.basicCapturePass = basicCapturePass;
        this.enrichmentPass = enrichmentPass;
        this.checkpointWriter = checkpointWriter;
        this.clock = clock;
    }

    public HarvestRunSummary run() {
        Instant startedAt = clock.instant();
        String runId = DateTimeFormatter.ofPattern(RUN_ID_PATTERN).withZone(clock.getZone()).format(startedAt);
        Path outputDirectory = Path.of(properties.getOutput().getDirectory()).resolve("output_" + runId);
        RunContext context = new RunContext(runId, properties, outputDirectory, startedAt);
        log.info("Starting harvest run {} for {}", runId, properties.getListing().getUrl());

        ConvergenceResult convergence;
        try (BrowserSession session = browserSessionFactory.open()) {
            convergence = discover(session, context);
            CapturePassResult capture = basicCapturePass.capture(convergence.links(), context);
            if (context.records().isEmpty()) {
                log.warn("No records captured in run {}; skipping enrichment", runId);
            } else {
                enrichmentPass.enrich(session, context);
            }
            checkpointWriter.writeFinal(context);
            warnIfIncomplete(convergence.links().size(), capture, context);
        } finally {
            context.stats().finish(clock.instant());
            log.info("Harvest run {} finished: {}", runId, context.stats());
        }

        return new HarvestRunSummary(
            runId,
            startedAt,
            context.stats().getEndTime(),
            outputDirectory,
            convergence.links().size(),
            convergence.outcome(),
            context.records().size(),
            context.stats()
        );
    }

    private ConvergenceResult discover(BrowserSession session, RunContext context) {
        String listingUrl = properties.getListing().getUrl();
        try {
            session.navigate(listingUrl, Duration.ofMillis(properties.getBrowser().getPageTimeoutMs()));
        } catch (NavigationException e) {
            log.warn("Listing page did not load cleanly, scrolling whatever rendered: {}", e.getMessage());
        }
        if (!Pauses.pause(properties.getScroll().getListingSettleDelayMs())) {
            log.warn("Interrupted while waiting for the listing page to settle");
        }

        ConvergenceResult convergence = scrollConvergenceLoop.converge(session, context);
        int minExpected = properties.getCapture().getMinExpectedRecords();
        if (convergence.links().size() < minExpected) {
            log.warn(
                "Discovered only {} record links, expected at least {} (outcome={})",
                convergence.links().size(),
                minExpected,
                convergence.outcome()
            );
        }
        return convergence;
    }

    private void warnIfIncomplete(int discovered, CapturePassResult capture, RunContext context) {
        int accepted = discovered - capture.skipped() - capture.duplicates();
        int records = context.records().size();
        if (accepted > 0 && records < accepted * COMPLETENESS_WARNING_RATIO) {
            log.warn("Only {} of {} accepted links became records", records, accepted);
        }
    }
}
