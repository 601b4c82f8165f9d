package com.delta.harvester.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public record Founder(
    @JsonProperty("name") String name,
    @JsonProperty("profile_url") String profileUrl
) {
    public Founder {
        name = name == null ? "" : name.trim();
        profileUrl = profileUrl == null ? "" : profileUrl.trim();
    }

    public static Founder nameOnly(String name) {
        return new Founder(name, "");
    }

    public boolean hasProfileUrl() {
        return !profileUrl.isEmpty();
    }

    @JsonIgnore
    public String dedupKey() {
        return hasProfileUrl()
            ? "url:" + profileUrl.toLowerCase(Locale.ROOT)
            : "name:" + name.toLowerCase(Locale.ROOT);
    }
}
