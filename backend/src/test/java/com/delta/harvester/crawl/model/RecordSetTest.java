package com.delta.harvester.crawl.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordSetTest {
    private static final Instant AT = Instant.parse("2025-07-01T12:00:00Z");

    @Test
    void firstOccurrenceWinsAndOrderIsKept() {
        RecordSet records = new RecordSet();
        assertThat(records.add(record("b", "Bolt"))).isTrue();
        assertThat(records.add(record("a", "Acme"))).isTrue();
        assertThat(records.add(record("b", "Bolt again"))).isFalse();

        assertThat(records.size()).isEqualTo(2);
        assertThat(records.snapshot()).extracting(CompanyRecord::name).containsExactly("Bolt", "Acme");
    }

    @Test
    void chunksFollowDiscoveryOrder() {
        RecordSet records = new RecordSet();
        for (String slug : List.of("a", "b", "c", "d", "e", "f", "g")) {
            records.add(record(slug, slug.toUpperCase()));
        }

        List<List<CompanyRecord>> chunks = records.chunks(3);

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0)).extracting(CompanyRecord::name).containsExactly("A", "B", "C");
        assertThat(chunks.get(2)).extracting(CompanyRecord::name).containsExactly("G");
    }

    private static CompanyRecord record(String slug, String name) {
        return new CompanyRecord("https://www.ycombinator.com/companies/" + slug, name, List.of(), AT);
    }
}
