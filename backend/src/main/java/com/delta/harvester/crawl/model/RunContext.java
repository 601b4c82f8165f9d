package com.delta.harvester.crawl.model;

import com.delta.harvester.config.HarvesterProperties;

import java.nio.file.Path;
import java.time.Instant;

public class RunContext {
    private final String runId;
    private final HarvesterProperties properties;
    private final Path outputDirectory;
    private final RecordSet records = new RecordSet();
    private final SessionStats stats;

    public RunContext(String runId, HarvesterProperties properties, Path outputDirectory, Instant startedAt) {
        this.runId = runId;
        this.properties = properties;
        this.outputDirectory = outputDirectory;
        this.stats = new SessionStats(startedAt);
    }

    public String runId() {
        return runId;
    }

    public HarvesterProperties properties() {
        return properties;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public RecordSet records() {
        return records;
    }

    public SessionStats stats() {
        return stats;
    }
}
