package com.delta.harvester.crawl.util;

import com.delta.harvester.crawl.browser.NavigationFailedException;
import com.delta.harvester.crawl.browser.NavigationTimeoutException;

import java.util.Locale;

public final class EnrichmentReasonCodes {
    public static final String TIMEOUT = "TIMEOUT";
    public static final String NAVIGATION_FAILED = "NAVIGATION_FAILED";
    public static final String HTTP_404 = "HTTP_404";
    public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
    public static final String HTTP_5XX = "HTTP_5XX";
    public static final String EMPTY_CONTENT = "EMPTY_CONTENT";
    public static final String PARSING_FAILED = "PARSING_FAILED";
    public static final String INTERRUPTED = "INTERRUPTED";
    public static final String UNKNOWN = "UNKNOWN";

    private EnrichmentReasonCodes() {
    }

    public static String fromException(Throwable error) {
        if (error == null) {
            return UNKNOWN;
        }
        if (error instanceof NavigationTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof NavigationFailedException failed) {
            Integer status = parseHttpStatus(failed.errorText());
            if (status != null) {
                return fromHttpStatus(status);
            }
            String lower = failed.errorText() == null ? "" : failed.errorText().toLowerCase(Locale.ROOT);
            return lower.contains("timeout") ? TIMEOUT : NAVIGATION_FAILED;
        }
        if (error instanceof InterruptedException) {
            return INTERRUPTED;
        }
        return PARSING_FAILED;
    }

    public static String fromHttpStatus(int status) {
        if (status == 404) {
            return HTTP_404;
        }
        if (status == 408) {
            return TIMEOUT;
        }
        if (status == 429) {
            return HTTP_429_RATE_LIMIT;
        }
        if (status >= 500 && status < 600) {
            return HTTP_5XX;
        }
        return NAVIGATION_FAILED;
    }

    static Integer parseHttpStatus(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int idx = lower.indexOf("http ");
        if (idx < 0) {
            return null;
        }
        String tail = lower.substring(idx + 5);
        int end = 0;
        while (end < tail.length() && Character.isDigit(tail.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return null;
        }
        try {
            return Integer.parseInt(tail.substring(0, end));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
