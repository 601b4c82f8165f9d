package com.delta.harvester.crawl.browser;

public interface BrowserElement {

    String attribute(String name);

    String textContent();
}
