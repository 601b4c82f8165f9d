package com.delta.harvester.crawl.model;

import java.util.ArrayList;
import java.util.List;

public record EnrichedFields(
    String name,
    String description,
    String summary,
    List<Founder> founders,
    List<String> categories) {

    public EnrichedFields {
        name = blankToEmpty(name);
        description = blankToEmpty(description);
        summary = blankToEmpty(summary);
        founders = founders == null ? List.of() : List.copyOf(founders);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static EnrichedFields empty() {
        return new EnrichedFields("", "", "", List.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    public static class Builder {
        private String name;
        private String description;
        private String summary;
        private final List<Founder> founders = new ArrayList<>();
        private final List<String> categories = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder founders(List<Founder> founders) {
            this.founders.addAll(founders);
            return this;
        }

        public Builder categories(List<String> categories) {
            this.categories.addAll(categories);
            return this;
        }

        public EnrichedFields build() {
            return new EnrichedFields(name, description, summary, founders, categories);
        }
    }
}
