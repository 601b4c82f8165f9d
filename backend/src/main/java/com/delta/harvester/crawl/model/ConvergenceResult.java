package com.delta.harvester.crawl.model;

import java.util.List;

public record ConvergenceResult(
    List<ListingLink> links,
    int rounds,
    ConvergenceOutcome outcome,
    int heightStableRounds,
    int linkSetStableRounds) {}
