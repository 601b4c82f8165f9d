package com.delta.harvester.crawl.browser;

import java.time.Duration;
import java.util.List;

/**
 * The capability set the harvest pipeline needs from a live browser tab.
 * One session is driven by exactly one thread.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Loads {@code url} in the session's tab, waiting at most {@code timeout} for the DOM to be ready.
     */
    void navigate(String url, Duration timeout) throws NavigationException;

    /**
     * Evaluates a JavaScript expression in the current page and returns its (JSON-compatible) value.
     */
    Object evaluate(String script);

    List<BrowserElement> queryAll(String selector);

    /**
     * @return the serialized HTML of the current page
     */
    String content();

    @Override
    void close();
}
