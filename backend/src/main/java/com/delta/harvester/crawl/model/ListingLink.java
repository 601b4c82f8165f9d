package com.delta.harvester.crawl.model;

public record ListingLink(String href, String text) {
    public ListingLink {
        text = text == null ? "" : text;
    }
}
