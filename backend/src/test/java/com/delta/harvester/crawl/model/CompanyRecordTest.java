package com.delta.harvester.crawl.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompanyRecordTest {
    private static final Instant CAPTURED_AT = Instant.parse("2025-07-01T12:00:00Z");
    private static final Instant ENRICHED_AT = Instant.parse("2025-07-01T12:10:00Z");
    private static final String ACME = "https://www.ycombinator.com/companies/acme";

    @Test
    void enrichmentNeverOverwritesFieldsWithEmptyValues() {
        CompanyRecord record = new CompanyRecord(ACME, "Acme", List.of("Fintech"), CAPTURED_AT);
        EnrichedFields fields = EnrichedFields.builder()
            .name("")
            .description("Acme automates invoicing.")
            .categories(List.of("B2B", "Fintech"))
            .build();

        record.applyEnrichment(fields, ENRICHED_AT);

        assertThat(record.status()).isEqualTo(RecordStatus.ENRICHED);
        assertThat(record.name()).isEqualTo("Acme");
        assertThat(record.description()).isEqualTo("Acme automates invoicing.");
        assertThat(record.summary()).isEqualTo(CompanyRecord.SUMMARY_NOT_AVAILABLE);
        assertThat(record.categories()).containsExactly("Fintech", "B2B");
        assertThat(record.capturedAt()).isEqualTo(CAPTURED_AT);
        assertThat(record.enrichedAt()).isEqualTo(ENRICHED_AT);
    }

    @Test
    void failureMergesPartialFieldsAndFillsSentinels() {
        CompanyRecord record = new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT);
        EnrichedFields partial = EnrichedFields.builder()
            .founders(List.of(new Founder("Jane Doe", "https://www.linkedin.com/in/janedoe")))
            .build();

        record.failEnrichment(new EnrichmentError("PARSING_FAILED", "boom", partial), ENRICHED_AT);

        assertThat(record.status()).isEqualTo(RecordStatus.ENRICHMENT_FAILED);
        assertThat(record.description()).isEqualTo(CompanyRecord.DESCRIPTION_NOT_AVAILABLE);
        assertThat(record.founders()).hasSize(1);
        assertThat(record.enrichmentError()).isEqualTo("PARSING_FAILED");
    }

    @Test
    void statusOnlyMovesForwardOnce() {
        CompanyRecord record = new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT);
        record.applyEnrichment(EnrichedFields.empty(), ENRICHED_AT);

        assertThatThrownBy(() -> record.applyEnrichment(EnrichedFields.empty(), ENRICHED_AT))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> record.failEnrichment(new EnrichmentError("TIMEOUT", "late", null), ENRICHED_AT))
            .isInstanceOf(IllegalStateException.class);
        assertThat(record.status()).isEqualTo(RecordStatus.ENRICHED);
    }

    @Test
    void foundersAreDedupedAndCapped() {
        CompanyRecord record = new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT);
        EnrichedFields fields = EnrichedFields.builder()
            .founders(List.of(
                new Founder("Jane Doe", "https://www.linkedin.com/in/janedoe"),
                new Founder("Jane D.", "https://www.linkedin.com/in/JaneDoe"),
                Founder.nameOnly("Bo Chen"),
                Founder.nameOnly(""),
                Founder.nameOnly("Cy Dunn"),
                Founder.nameOnly("Di Evans"),
                Founder.nameOnly("Ed Fox"),
                Founder.nameOnly("Flo Gray")
            ))
            .build();

        record.applyEnrichment(fields, ENRICHED_AT);

        assertThat(record.founders())
            .extracting(Founder::name)
            .containsExactly("Jane Doe", "Bo Chen", "Cy Dunn", "Di Evans", "Ed Fox");
    }

    @Test
    void headingReplacesNameOnlyWhenItIsALongerForm() {
        assertThat(CompanyRecord.preferName("Acme", "Acme Robotics")).isEqualTo("Acme Robotics");
        assertThat(CompanyRecord.preferName("Acme Robotics", "Acme")).isEqualTo("Acme Robotics");
        assertThat(CompanyRecord.preferName("Acme", "Welcome to our site")).isEqualTo("Acme");
        assertThat(CompanyRecord.preferName("", "Acme")).isEqualTo("Acme");
        assertThat(CompanyRecord.preferName(
            "Acme Robotics Warehouse robots that pick and pack orders for you",
            "Acme Robotics"
        )).isEqualTo("Acme Robotics");
    }
}
