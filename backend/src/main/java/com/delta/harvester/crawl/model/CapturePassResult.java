package com.delta.harvester.crawl.model;

public record CapturePassResult(int captured, int skipped, int duplicates, int errors) {}
