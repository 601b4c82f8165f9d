package com.delta.harvester.crawl.browser;

public interface BrowserSessionFactory {

    BrowserSession open();
}
