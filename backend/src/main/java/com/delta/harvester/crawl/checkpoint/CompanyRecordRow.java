package com.delta.harvester.crawl.checkpoint;

import com.delta.harvester.crawl.model.CompanyRecord;
import com.delta.harvester.crawl.model.Founder;
import com.delta.harvester.crawl.model.RecordStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

@JsonPropertyOrder({
    "name", "description", "url", "categories", "founders", "summary", "scraped_at", "enriched_at", "status", "error"
})
public record CompanyRecordRow(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("url") String url,
    @JsonProperty("categories") List<String> categories,
    @JsonProperty("founders") List<Founder> founders,
    @JsonProperty("summary") String summary,
    @JsonProperty("scraped_at") Instant scrapedAt,
    @JsonProperty("enriched_at") Instant enrichedAt,
    @JsonProperty("status") RecordStatus status,
    @JsonProperty("error") String error
) {
    public static CompanyRecordRow from(CompanyRecord record) {
        return new CompanyRecordRow(
            record.name(),
            record.description(),
            record.identityKey(),
            record.categories(),
            record.founders(),
            record.summary(),
            record.capturedAt(),
            record.enrichedAt(),
            record.status(),
            record.enrichmentError()
        );
    }
}
