package com.delta.harvester.crawl.model;

import java.nio.file.Path;
import java.time.Instant;

public record HarvestRunSummary(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    Path outputDirectory,
    int discoveredLinks,
    ConvergenceOutcome convergence,
    int recordCount,
    SessionStats stats) {}
