package com.delta.harvester.crawl.model;

public record EnrichmentResult(String identityKey, EnrichedFields fields, EnrichmentError error) {

    public static EnrichmentResult success(String identityKey, EnrichedFields fields) {
        return new EnrichmentResult(identityKey, fields, null);
    }

    public static EnrichmentResult failure(String identityKey, EnrichmentError error) {
        return new EnrichmentResult(identityKey, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
