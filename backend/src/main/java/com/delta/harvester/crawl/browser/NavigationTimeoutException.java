package com.delta.harvester.crawl.browser;

public class NavigationTimeoutException extends NavigationException {
    public NavigationTimeoutException(String url, String message, Throwable cause) {
        super(url, message, cause);
    }
}
