package com.delta.harvester.crawl.enrich;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.config.TestHarvesterProperties;
import com.delta.harvester.crawl.browser.FakeBrowserSession;
import com.delta.harvester.crawl.browser.NavigationTimeoutException;
import com.delta.harvester.crawl.checkpoint.CheckpointWriter;
import com.delta.harvester.crawl.extract.CategoryExtractor;
import com.delta.harvester.crawl.extract.DescriptionExtractor;
import com.delta.harvester.crawl.extract.DetailPageExtractor;
import com.delta.harvester.crawl.extract.FounderExtractor;
import com.delta.harvester.crawl.extract.NameExtractor;
import com.delta.harvester.crawl.extract.SummaryExtractor;
import com.delta.harvester.crawl.model.CompanyRecord;
import com.delta.harvester.crawl.model.EnrichedFields;
import com.delta.harvester.crawl.model.EnrichmentPassResult;
import com.delta.harvester.crawl.model.EnrichmentResult;
import com.delta.harvester.crawl.model.RecordStatus;
import com.delta.harvester.crawl.model.RunContext;
import com.delta.harvester.crawl.util.EnrichmentReasonCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentPassTest {
    private static final Instant CAPTURED_AT = Instant.parse("2025-07-01T12:00:00Z");
    private static final Instant ENRICHED_AT = Instant.parse("2025-07-01T12:05:00Z");
    private static final String ACME = "https://www.ycombinator.com/companies/acme";
    private static final String BOLT = "https://www.ycombinator.com/companies/bolt";
    private static final String CORE = "https://www.ycombinator.com/companies/core";

    @Mock
    private CheckpointWriter checkpointWriter;

    @Mock
    private RecordEnricher recordEnricher;

    @Test
    void timeoutLeavesSentinelsAndFailedStatusWhileOthersEnrich() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        properties.getEnrichment().setChunkSize(2);
        RunContext context = context(properties);
        context.records().add(new CompanyRecord(ACME, "Acme", List.of("Fintech"), CAPTURED_AT));
        context.records().add(new CompanyRecord(BOLT, "Bolt", List.of(), CAPTURED_AT));
        context.records().add(new CompanyRecord(CORE, "Core", List.of(), CAPTURED_AT));
        FakeBrowserSession session = new FakeBrowserSession()
            .withPage(ACME, page("Acme", "Acme builds an AI platform that automates invoicing for enterprises."))
            .withNavigationFailure(BOLT, new NavigationTimeoutException(BOLT, "Timed out after 15000ms", null))
            .withPage(CORE, page("Core", "Core provides a compliance platform for community banks and credit unions."));
        CompanyRecord bolt = context.records().get(BOLT);
        assertThat(bolt.description()).isEmpty();

        EnrichmentPassResult result = pass().enrich(session, context);

        assertThat(result.enriched()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.chunks()).isEqualTo(2);
        assertThat(session.navigations()).containsExactly(ACME, BOLT, CORE);

        assertThat(bolt.status()).isEqualTo(RecordStatus.ENRICHMENT_FAILED);
        assertThat(bolt.description()).isEqualTo(CompanyRecord.DESCRIPTION_NOT_AVAILABLE);
        assertThat(bolt.summary()).isEqualTo(CompanyRecord.SUMMARY_NOT_AVAILABLE);
        assertThat(bolt.enrichmentError()).isEqualTo(EnrichmentReasonCodes.TIMEOUT);
        assertThat(bolt.enrichedAt()).isEqualTo(ENRICHED_AT);

        CompanyRecord acme = context.records().get(ACME);
        assertThat(acme.status()).isEqualTo(RecordStatus.ENRICHED);
        assertThat(acme.description()).isEqualTo("Acme builds an AI platform that automates invoicing for enterprises.");
        assertThat(acme.summary()).startsWith("What They Do: Acme builds");
        assertThat(acme.categories()).containsExactly("Fintech");
        assertThat(acme.capturedAt()).isEqualTo(CAPTURED_AT);

        assertThat(context.records().countByStatus(RecordStatus.CAPTURED)).isZero();
        assertThat(context.stats().getSuccessfulEnrichments()).isEqualTo(2);
        assertThat(context.stats().getErrors()).isEqualTo(1);
        verify(checkpointWriter, times(2)).snapshot(context);
    }

    @Test
    void emptyPageIsRecordedAsFailedWithSentinels() {
        RunContext context = context(TestHarvesterProperties.withoutDelays());
        context.records().add(new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT));
        FakeBrowserSession session = new FakeBrowserSession().withPage(ACME, "   ");

        EnrichmentPassResult result = pass().enrich(session, context);

        CompanyRecord acme = context.records().get(ACME);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(acme.status()).isEqualTo(RecordStatus.ENRICHMENT_FAILED);
        assertThat(acme.enrichmentError()).isEqualTo(EnrichmentReasonCodes.EMPTY_CONTENT);
        assertThat(acme.name()).isEqualTo("Acme");
    }

    @Test
    void uncheckedBrowserFailureOnOnePageDoesNotStopThePass() {
        RunContext context = context(TestHarvesterProperties.withoutDelays());
        context.records().add(new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT));
        context.records().add(new CompanyRecord(BOLT, "Bolt", List.of(), CAPTURED_AT));
        context.records().add(new CompanyRecord(CORE, "Core", List.of(), CAPTURED_AT));
        FakeBrowserSession session = new FakeBrowserSession()
            .withPage(ACME, page("Acme", "Acme builds an AI platform that automates invoicing for enterprises."))
            .withCrash(BOLT, new IllegalStateException("Target page, context or browser has been closed"))
            .withPage(CORE, page("Core", "Core provides a compliance platform for community banks and credit unions."));

        EnrichmentPassResult result = pass().enrich(session, context);

        assertThat(session.navigations()).containsExactly(ACME, BOLT, CORE);
        assertThat(result.enriched()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        CompanyRecord bolt = context.records().get(BOLT);
        assertThat(bolt.status()).isEqualTo(RecordStatus.ENRICHMENT_FAILED);
        assertThat(bolt.enrichmentError()).isEqualTo(EnrichmentReasonCodes.NAVIGATION_FAILED);
        assertThat(bolt.description()).isEqualTo(CompanyRecord.DESCRIPTION_NOT_AVAILABLE);
        assertThat(context.records().get(CORE).status()).isEqualTo(RecordStatus.ENRICHED);
        assertThat(context.records().countByStatus(RecordStatus.CAPTURED)).isZero();
    }

    @Test
    void enricherBugIsIsolatedToItsRecord() {
        RunContext context = context(TestHarvesterProperties.withoutDelays());
        CompanyRecord acme = new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT);
        CompanyRecord bolt = new CompanyRecord(BOLT, "Bolt", List.of(), CAPTURED_AT);
        context.records().add(acme);
        context.records().add(bolt);
        FakeBrowserSession session = new FakeBrowserSession();
        when(recordEnricher.enrich(eq(session), eq(acme), any())).thenThrow(new IllegalArgumentException("boom"));
        when(recordEnricher.enrich(eq(session), eq(bolt), any()))
            .thenReturn(EnrichmentResult.success(BOLT, EnrichedFields.builder().description("Bolt ships payroll APIs.").build()));

        EnrichmentPassResult result = new EnrichmentPass(recordEnricher, checkpointWriter, Clock.fixed(ENRICHED_AT, ZoneOffset.UTC))
            .enrich(session, context);

        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.enriched()).isEqualTo(1);
        assertThat(acme.status()).isEqualTo(RecordStatus.ENRICHMENT_FAILED);
        assertThat(acme.enrichmentError()).isEqualTo(EnrichmentReasonCodes.UNKNOWN);
        assertThat(bolt.status()).isEqualTo(RecordStatus.ENRICHED);
        assertThat(context.stats().getErrors()).isEqualTo(1);
    }

    @Test
    void interruptStopsNavigationAndFailsUnvisitedRecords() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        properties.getEnrichment().setChunkSize(2);
        RunContext context = context(properties);
        context.records().add(new CompanyRecord(ACME, "Acme", List.of(), CAPTURED_AT));
        context.records().add(new CompanyRecord(BOLT, "Bolt", List.of(), CAPTURED_AT));
        context.records().add(new CompanyRecord(CORE, "Core", List.of(), CAPTURED_AT));
        FakeBrowserSession session = new FakeBrowserSession()
            .withPage(ACME, page("Acme", "Acme builds an AI platform that automates invoicing for enterprises."))
            .withPage(BOLT, page("Bolt", "Bolt ships payroll APIs for small businesses across Latin America."))
            .withPage(CORE, page("Core", "Core provides a compliance platform for community banks and credit unions."))
            .withInterruptAfter(ACME);

        EnrichmentPassResult result;
        try {
            result = pass().enrich(session, context);
        } finally {
            Thread.interrupted();
        }

        assertThat(session.navigations()).containsExactly(ACME);
        assertThat(result.enriched()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.chunks()).isZero();
        assertThat(context.records().get(ACME).status()).isEqualTo(RecordStatus.ENRICHED);
        for (String url : List.of(BOLT, CORE)) {
            CompanyRecord record = context.records().get(url);
            assertThat(record.status()).isEqualTo(RecordStatus.ENRICHMENT_FAILED);
            assertThat(record.enrichmentError()).isEqualTo(EnrichmentReasonCodes.INTERRUPTED);
        }
        assertThat(context.records().countByStatus(RecordStatus.CAPTURED)).isZero();
        verify(checkpointWriter, times(1)).snapshot(context);
    }

    private EnrichmentPass pass() {
        DetailPageExtractor extractor = new DetailPageExtractor(
            new DescriptionExtractor(),
            new FounderExtractor(new NameExtractor()),
            new SummaryExtractor(),
            new CategoryExtractor()
        );
        return new EnrichmentPass(new RecordEnricher(extractor), checkpointWriter, Clock.fixed(ENRICHED_AT, ZoneOffset.UTC));
    }

    private static String page(String name, String paragraph) {
        return "<html><body><h1>" + name + "</h1><main><p>" + paragraph + "</p></main></body></html>";
    }

    private static RunContext context(HarvesterProperties properties) {
        return new RunContext("20250701_120000", properties, Path.of("build"), CAPTURED_AT);
    }
}
