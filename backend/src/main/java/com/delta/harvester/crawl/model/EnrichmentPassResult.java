package com.delta.harvester.crawl.model;

public record EnrichmentPassResult(int chunks, int enriched, int failed) {}
