package com.delta.harvester.crawl.discovery;

import com.delta.harvester.config.HarvesterProperties;
import com.delta.harvester.crawl.browser.BrowserElement;
import com.delta.harvester.crawl.browser.BrowserSession;
import com.delta.harvester.crawl.model.ConvergenceOutcome;
import com.delta.harvester.crawl.model.ConvergenceResult;
import com.delta.harvester.crawl.model.ListingLink;
import com.delta.harvester.crawl.model.RunContext;
import com.delta.harvester.crawl.util.Pauses;
import com.delta.harvester.crawl.util.RecordUrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scrolls a lazily loaded listing until the set of record links stops growing.
 *
 * <p>Each round scrolls to the bottom, waits for lazy content to mount and then observes
 * the page height and the record links currently in the DOM. Link-set stability is the only
 * termination signal; the height is tracked for diagnostics because virtualized lists can
 * keep a constant height while still mounting new rows.
 *
 * <p>Links are accumulated across rounds, keyed by identity, so rows that a virtualized
 * list unmounts after scrolling past them are not lost.
 */
@Component
public class ScrollConvergenceLoop {
    private static final Logger log = LoggerFactory.getLogger(ScrollConvergenceLoop.class);

    static final String SCROLL_TO_BOTTOM = "window.scrollTo(0, document.body.scrollHeight)";
    static final String PAGE_HEIGHT = "document.body.scrollHeight";

    public ConvergenceResult converge(BrowserSession session, RunContext context) {
        HarvesterProperties properties = context.properties();
        HarvesterProperties.Scroll scroll = properties.getScroll();
        String linkSelector = properties.getListing().getLinkSelector();
        int requiredStableRounds = scroll.getStabilityRounds();
        int maxAttempts = scroll.getMaxAttempts();
        int upperBound = properties.getCapture().getTargetRecordUpperBound();
        RecordUrlNormalizer normalizer = RecordUrlNormalizer.forListing(properties.getListing());

        Map<String, ListingLink> seen = new LinkedHashMap<>();
        long lastHeight = -1;
        int heightStableRounds = 0;
        int linkSetStableRounds = 0;
        int rounds = 0;
        ConvergenceOutcome outcome = ConvergenceOutcome.MAX_ATTEMPTS;

        try {
            lastHeight = readHeight(session);
            while (rounds < maxAttempts) {
                rounds++;
                session.evaluate(SCROLL_TO_BOTTOM);
                if (!Pauses.pause(scroll.getDelayMs())) {
                    log.warn("Scrolling interrupted after {} rounds", rounds);
                    outcome = ConvergenceOutcome.FAILED;
                    break;
                }

                long height = readHeight(session);
                if (height == lastHeight) {
                    heightStableRounds++;
                } else {
                    heightStableRounds = 0;
                    lastHeight = height;
                }

                int before = seen.size();
                collectLinks(session, linkSelector, normalizer, seen);
                if (seen.size() == before) {
                    linkSetStableRounds++;
                } else {
                    linkSetStableRounds = 0;
                }
                log.debug(
                    "Scroll round {}: height={} links={} heightStable={} linkSetStable={}",
                    rounds,
                    height,
                    seen.size(),
                    heightStableRounds,
                    linkSetStableRounds
                );

                if (seen.size() >= upperBound) {
                    log.info("Collected {} unique record links, reached upper bound {}", seen.size(), upperBound);
                    outcome = ConvergenceOutcome.UPPER_BOUND;
                    break;
                }
                if (linkSetStableRounds >= requiredStableRounds) {
                    outcome = ConvergenceOutcome.CONVERGED;
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.warn("Scrolling failed after {} rounds with {} links collected", rounds, seen.size(), e);
            outcome = ConvergenceOutcome.FAILED;
        }

        if (outcome == ConvergenceOutcome.MAX_ATTEMPTS) {
            log.warn(
                "Link set did not stabilize within {} scroll rounds; continuing with {} links",
                maxAttempts,
                seen.size()
            );
        } else {
            log.info(
                "Finished scrolling: outcome={} rounds={} links={} linkSetStable={} heightStable={}",
                outcome,
                rounds,
                seen.size(),
                linkSetStableRounds,
                heightStableRounds
            );
        }
        return new ConvergenceResult(
            new ArrayList<>(seen.values()),
            rounds,
            outcome,
            heightStableRounds,
            linkSetStableRounds
        );
    }

    private void collectLinks(
        BrowserSession session,
        String linkSelector,
        RecordUrlNormalizer normalizer,
        Map<String, ListingLink> seen
    ) {
        List<BrowserElement> anchors = session.queryAll(linkSelector);
        for (BrowserElement anchor : anchors) {
            String href = anchor.attribute("href");
            Optional<String> identity = normalizer.normalize(href);
            if (identity.isEmpty()) {
                continue;
            }
            ListingLink existing = seen.get(identity.get());
            if (existing == null) {
                seen.put(identity.get(), new ListingLink(href, anchor.textContent()));
            } else if (existing.text().isBlank()) {
                // image-only anchors often precede the titled anchor of the same card
                String text = anchor.textContent();
                if (text != null && !text.isBlank()) {
                    seen.put(identity.get(), new ListingLink(existing.href(), text));
                }
            }
        }
    }

    private long readHeight(BrowserSession session) {
        Object value = session.evaluate(PAGE_HEIGHT);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException ignored) {
            return -1;
        }
    }
}
