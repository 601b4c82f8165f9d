package com.delta.harvester.crawl.enrich;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.crawl.browser.BrowserSession;
import com.delta.harvester.crawl.checkpoint.CheckpointException;
import com.delta.harvester.crawl.checkpoint.CheckpointWriter;
import com.delta.harvester.crawl.model.CompanyRecord;
import com.delta.harvester.crawl.model.EnrichmentError;
import com.delta.harvester.crawl.model.EnrichmentPassResult;
import com.delta.harvester.crawl.model.EnrichmentResult;
import com.delta.harvester.crawl.model.RunContext;
import com.delta.harvester.crawl.model.SessionStats;
import com.delta.harvester.crawl.util.EnrichmentReasonCodes;
import com.delta.harvester.crawl.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Pass 2: visits each captured record's detail page in small chunks and merges the results.
 * Every record leaves this pass as either {@code ENRICHED} or {@code ENRICHMENT_FAILED}, including
 * after an interrupt; failed records are not retried within the run.
 */
@Component
public class EnrichmentPass {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentPass.class);

    private final RecordEnricher recordEnricher;
    private final CheckpointWriter checkpointWriter;
    private final Clock clock;

    public EnrichmentPass(RecordEnricher recordEnricher, CheckpointWriter checkpointWriter, Clock clock) {
        this.recordEnricher = recordEnricher;
        this.checkpointWriter = checkpointWriter;
        this.clock = clock;
    }

    public EnrichmentPassResult enrich(BrowserSession session, RunContext context) {
        HarvesterProperties.Enrichment settings = context.properties().getEnrichment();
        SessionStats stats = context.stats();
        List<List<CompanyRecord>> chunks = context.records().chunks(settings.getChunkSize());
        int total = context.records().size();

        log.info("Pass 2: enriching {} records in {} chunks of {}", total, chunks.size(), settings.getChunkSize());
        int enriched = 0;
        int failed = 0;
        int position = 0;
        int chunksDone = 0;
        boolean interrupted = false;
        for (List<CompanyRecord> chunk : chunks) {
            for (CompanyRecord record : chunk) {
                position++;
                if (record.status().isTerminal()) {
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    interrupted = true;
                    break;
                }
                EnrichmentResult result = enrichOne(session, record, settings);
                if (result.isSuccess()) {
                    record.applyEnrichment(result.fields(), clock.instant());
                    stats.recordEnrichment();
                    enriched++;
                    log.info("Enriched {}/{}: {}", position, total, record.name());
                } else {
                    record.failEnrichment(result.error(), clock.instant());
                    stats.recordError();
                    failed++;
                    log.warn(
                        "Enrichment failed {}/{}: {} reason={}",
                        position,
                        total,
                        record.identityKey(),
                        result.error().reasonCode()
                    );
                }
            }
            if (interrupted) {
                break;
            }
            chunksDone++;
            saveProgress(context);
            if (chunksDone < chunks.size() && !Pauses.pause(settings.getChunkDelayMs())) {
                interrupted = true;
                break;
            }
        }
        if (interrupted) {
            int unvisited = failUnvisited(chunks, stats);
            failed += unvisited;
            log.warn(
                "Enrichment interrupted after {} of {} chunks; {} unvisited records marked {}",
                chunksDone,
                chunks.size(),
                unvisited,
                EnrichmentReasonCodes.INTERRUPTED
            );
            saveProgress(context);
        }
        log.info("Pass 2 complete: enriched={} failed={} chunks={}", enriched, failed, chunksDone);
        return new EnrichmentPassResult(chunksDone, enriched, failed);
    }

    private EnrichmentResult enrichOne(BrowserSession session, CompanyRecord record, HarvesterProperties.Enrichment settings) {
        try {
            return recordEnricher.enrich(session, record, settings);
        } catch (RuntimeException e) {
            log.error("Unexpected error enriching {}", record.identityKey(), e);
            return EnrichmentResult.failure(
                record.identityKey(),
                new EnrichmentError(EnrichmentReasonCodes.UNKNOWN, String.valueOf(e.getMessage()), null)
            );
        }
    }

    private int failUnvisited(List<List<CompanyRecord>> chunks, SessionStats stats) {
        int count = 0;
        for (List<CompanyRecord> chunk : chunks) {
            for (CompanyRecord record : chunk) {
                if (record.status().isTerminal()) {
                    continue;
                }
                record.failEnrichment(
                    new EnrichmentError(EnrichmentReasonCodes.INTERRUPTED, "Not visited before interrupt", null),
                    clock.instant()
                );
                stats.recordError();
                count++;
            }
        }
        return count;
    }

    private void saveProgress(RunContext context) {
        try {
            checkpointWriter.snapshot(context);
        } catch (CheckpointException e) {
            log.warn("Progress checkpoint failed for run {}", context.runId(), e);
        }
    }
}
