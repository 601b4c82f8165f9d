package com.delta.harvester.crawl.model;

import java.time.Duration;
import java.time.Instant;

public class SessionStats {
    private final Instant startTime;
    private Instant endTime;
    private int totalProcessed;
    private int successfulCaptures;
    private int successfulEnrichments;
    private int errors;
    private int skipped;
    private int duplicates;

    public SessionStats(Instant startTime) {
        this.startTime = startTime;
    }

    public void recordProcessed() {
        ensureOpen();
        totalProcessed++;
    }

    public void recordCapture() {
        ensureOpen();
        successfulCaptures++;
    }

    public void recordEnrichment() {
        ensureOpen();
        successfulEnrichments++;
    }

    public void recordError() {
        ensureOpen();
        errors++;
    }

    public void recordSkipped() {
        ensureOpen();
        skipped++;
    }

    public void recordDuplicate() {
        ensureOpen();
        duplicates++;
    }

    public void finish(Instant at) {
        ensureOpen();
        endTime = at;
    }

    public boolean isFinished() {
        return endTime != null;
    }

    private void ensureOpen() {
        if (endTime != null) {
            throw new IllegalStateException("Session stats already finalized at " + endTime);
        }
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return endTime == null ? null : Duration.between(startTime, endTime);
    }

    public int getTotalProcessed() {
        return totalProcessed;
    }

    public int getSuccessfulCaptures() {
        return successfulCaptures;
    }

    public int getSuccessfulEnrichments() {
        return successfulEnrichments;
    }

    public int getErrors() {
        return errors;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getDuplicates() {
        return duplicates;
    }

    @Override
    public String toString() {
        return "processed=" + totalProcessed
            + ", captured=" + successfulCaptures
            + ", enriched=" + successfulEnrichments
            + ", errors=" + errors
            + ", skipped=" + skipped
            + ", duplicates=" + duplicates
            + ", duration=" + getDuration();
    }
}
