package com.delta.harvester.crawl.model;

public record EnrichmentError(String reasonCode, String message, EnrichedFields partialFields) {
    public EnrichmentError {
        partialFields = partialFields == null ? EnrichedFields.empty() : partialFields;
    }
}
