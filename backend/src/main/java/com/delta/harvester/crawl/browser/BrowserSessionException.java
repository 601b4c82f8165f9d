package com.delta.harvester.crawl.browser;

public class BrowserSessionException extends RuntimeException {
    public BrowserSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
