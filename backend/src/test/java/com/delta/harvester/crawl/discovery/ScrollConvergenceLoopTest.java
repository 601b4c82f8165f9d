package com.delta.harvester.crawl.discovery;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.config.TestHarvesterProperties;
import com.delta.harvester.crawl.browser.BrowserElement;
import com.delta.harvester.crawl.browser.FakeBrowserSession;
import com.delta.harvester.crawl.model.ConvergenceOutcome;
import com.delta.harvester.crawl.model.ConvergenceResult;
import com.delta.harvester.crawl.model.ListingLink;
import com.delta.harvester.crawl.model.RunContext;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScrollConvergenceLoopTest {
    private final ScrollConvergenceLoop loop = new ScrollConvergenceLoop();

    @Test
    void convergesOnceLinkCountHoldsForRequiredRounds() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        properties.getScroll().setStabilityRounds(3);
        FakeBrowserSession session = new FakeBrowserSession()
            .withListingFrame(companies(0, 20))
            .withListingFrame(companies(0, 47));

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.CONVERGED);
        assertThat(result.links()).hasSize(47);
        assertThat(result.rounds()).isEqualTo(5);
        assertThat(result.linkSetStableRounds()).isEqualTo(3);
    }

    @Test
    void keepsRowsThatAVirtualizedListUnmounts() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        List<ListingLink> first = new ArrayList<>(companies(0, 2));
        first.add(new ListingLink("/companies/founders", "Founder Directory"));
        first.add(new ListingLink("/companies?industry=Fintech", "Fintech"));
        FakeBrowserSession session = new FakeBrowserSession()
            .withListingFrame(first)
            .withListingFrame(companies(2, 3));

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.links())
            .extracting(ListingLink::href)
            .containsExactly("/companies/company-0", "/companies/company-1", "/companies/company-2");
    }

    @Test
    void laterTitledAnchorReplacesImageOnlyAnchor() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        FakeBrowserSession session = new FakeBrowserSession()
            .withListingFrame(List.of(
                new ListingLink("/companies/acme", ""),
                new ListingLink("/companies/acme/", "Acme\nB2B Fintech")
            ));

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.links()).containsExactly(new ListingLink("/companies/acme", "Acme\nB2B Fintech"));
    }

    @Test
    void stopsAtRecordUpperBound() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        properties.getCapture().setTargetRecordUpperBound(30);
        FakeBrowserSession session = new FakeBrowserSession()
            .withListingFrame(companies(0, 20))
            .withListingFrame(companies(0, 47));

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.UPPER_BOUND);
        assertThat(result.rounds()).isEqualTo(2);
        assertThat(result.links()).hasSize(47);
    }

    @Test
    void givesUpAfterMaxAttemptsWithWhatItHas() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        properties.getScroll().setMaxAttempts(4);
        FakeBrowserSession session = new FakeBrowserSession();
        for (int i = 1; i <= 6; i++) {
            session.withListingFrame(companies(0, i * 10));
        }

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.MAX_ATTEMPTS);
        assertThat(result.rounds()).isEqualTo(4);
        assertThat(result.links()).hasSize(40);
        assertThat(session.scrolls()).isEqualTo(4);
    }

    @Test
    void browserFailureKeepsLinksCollectedSoFar() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        FakeBrowserSession session = new FakeBrowserSession() {
            @Override
            public List<BrowserElement> queryAll(String selector) {
                if (scrolls() > 1) {
                    throw new IllegalStateException("Target page, context or browser has been closed");
                }
                return super.queryAll(selector);
            }
        }.withListingFrame(companies(0, 12));

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.FAILED);
        assertThat(result.links()).hasSize(12);
    }

    @Test
    void linkCountStabilityWinsOverGrowingPageHeight() {
        HarvesterProperties properties = TestHarvesterProperties.withoutDelays();
        properties.getScroll().setStabilityRounds(2);
        FakeBrowserSession session = new FakeBrowserSession() {
            private long height = 1000;

            @Override
            public Object evaluate(String script) {
                Object value = super.evaluate(script);
                if (value == null) {
                    return null;
                }
                height += 500;
                return height;
            }
        }.withListingFrame(companies(0, 5));

        ConvergenceResult result = loop.converge(session, context(properties));

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.CONVERGED);
        assertThat(result.heightStableRounds()).isZero();
        assertThat(result.rounds()).isEqualTo(3);
    }

    static List<ListingLink> companies(int from, int to) {
        List<ListingLink> links = new ArrayList<>();
        for (int i = from; i < to; i++) {
            links.add(new ListingLink("/companies/company-" + i, "Company " + i));
        }
        return links;
    }

    private static RunContext context(HarvesterProperties properties) {
        return new RunContext("20250101_000000", properties, Path.of("build"), Instant.parse("2025-01-01T00:00:00Z"));
    }
}
