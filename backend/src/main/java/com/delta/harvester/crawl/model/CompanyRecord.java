package com.delta.harvester.crawl.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One harvested company. Created by the capture pass, mutated in place by the enrichment pass.
 */
public class CompanyRecord {
    public static final String DESCRIPTION_NOT_AVAILABLE = "Description not available";
    public static final String SUMMARY_NOT_AVAILABLE = "Summary not available";
    public static final int MAX_FOUNDERS = 5;

    private static final int MAX_CLEAN_NAME_LENGTH = 80;

    private final String identityKey;
    private final Instant capturedAt;
    private final LinkedHashSet<String> categories = new LinkedHashSet<>();
    private final Map<String, Founder> founders = new LinkedHashMap<>();
    private String name;
    private String description = "";
    private String summary = "";
    private Instant enrichedAt;
    private RecordStatus status = RecordStatus.CAPTURED;
    private String enrichmentError = "";

    public CompanyRecord(String identityKey, String name, Collection<String> categories, Instant capturedAt) {
        this.identityKey = Objects.requireNonNull(identityKey, "identityKey");
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
        this.name = name == null ? "" : name.trim();
        addCategories(categories);
    }

    public void applyEnrichment(EnrichedFields fields, Instant at) {
        requireCaptured();
        merge(fields);
        fillSentinels();
        this.enrichedAt = at;
        this.status = RecordStatus.ENRICHED;
    }

    public void failEnrichment(EnrichmentError error, Instant at) {
        requireCaptured();
        merge(error.partialFields());
        fillSentinels();
        this.enrichedAt = at;
        this.enrichmentError = error.reasonCode() == null ? "" : error.reasonCode();
        this.status = RecordStatus.ENRICHMENT_FAILED;
    }

    private void requireCaptured() {
        if (status != RecordStatus.CAPTURED) {
            throw new IllegalStateException("Record " + identityKey + " already left CAPTURED (status=" + status + ")");
        }
    }

    private void merge(EnrichedFields fields) {
        if (fields == null) {
            return;
        }
        name = preferName(name, fields.name());
        if (!fields.description().isEmpty()) {
            description = fields.description();
        }
        if (!fields.summary().isEmpty()) {
            summary = fields.summary();
        }
        addCategories(fields.categories());
        for (Founder founder : fields.founders()) {
            if (founders.size() >= MAX_FOUNDERS) {
                break;
            }
            if (!founder.name().isEmpty()) {
                founders.putIfAbsent(founder.dedupKey(), founder);
            }
        }
    }

    private void fillSentinels() {
        if (description.isEmpty()) {
            description = DESCRIPTION_NOT_AVAILABLE;
        }
        if (summary.isEmpty()) {
            summary = SUMMARY_NOT_AVAILABLE;
        }
    }

    private void addCategories(Collection<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                categories.add(value.trim());
            }
        }
    }

    /**
     * The detail-page heading replaces the listing name only when it is a longer form of it,
     * or when the listing name is blank or a run-on of heading plus tagline.
     */
    static String preferName(String current, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return current;
        }
        String cleaned = candidate.trim().replaceAll("\\s+", " ");
        if (cleaned.length() > MAX_CLEAN_NAME_LENGTH) {
            return current;
        }
        if (current == null || current.isBlank()) {
            return cleaned;
        }
        String currentLower = current.toLowerCase(Locale.ROOT);
        String candidateLower = cleaned.toLowerCase(Locale.ROOT);
        if (candidateLower.length() > currentLower.length() && candidateLower.startsWith(currentLower)) {
            return cleaned;
        }
        if (currentLower.length() > candidateLower.length()
            && currentLower.startsWith(candidateLower)
            && current.length() > 50) {
            return cleaned;
        }
        return current;
    }

    public String identityKey() {
        return identityKey;
    }

    public String name() {
        return name;
    }

    public List<String> categories() {
        return List.copyOf(categories);
    }

    public String description() {
        return description;
    }

    public String summary() {
        return summary;
    }

    public List<Founder> founders() {
        return new ArrayList<>(founders.values());
    }

    public Instant capturedAt() {
        return capturedAt;
    }

    public Instant enrichedAt() {
        return enrichedAt;
    }

    public RecordStatus status() {
        return status;
    }

    public String enrichmentError() {
        return enrichmentError;
    }

    @Override
    public String toString() {
        return "CompanyRecord{" + identityKey + ", name=" + name + ", status=" + status + "}";
    }
}
