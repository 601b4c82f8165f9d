package com.delta.harvester.crawl.browser;

public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(String url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    public NavigationFailedException(String url, String errorText, Throwable cause) {
        super(url, errorText, cause);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
