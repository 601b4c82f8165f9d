package com.delta.harvester.crawl.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecordStatus {
    CAPTURED("captured"),
    ENRICHED("enriched"),
    ENRICHMENT_FAILED("enrichment_failed");

    private final String code;

    RecordStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this != CAPTURED;
    }
}
