package com.delta.harvester.crawl.model;

public enum ConvergenceOutcome {
    CONVERGED,
    UPPER_BOUND,
    MAX_ATTEMPTS,
    FAILED
}
