package com.delta.harvester.crawl.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class PlaywrightBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public void navigate(String url, Duration timeout) throws NavigationException {
        Response response;
        try {
            response = page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) timeout.toMillis()));
        } catch (TimeoutError e) {
            throw new NavigationTimeoutException(url, "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (PlaywrightException e) {
            throw new NavigationFailedException(url, firstLine(e.getMessage()), e);
        }
        if (response != null && response.status() >= 400) {
            throw new NavigationFailedException(url, "HTTP " + response.status());
        }
    }

    @Override
    public Object evaluate(String script) {
        return page.evaluate(script);
    }

    @Override
    public List<BrowserElement> queryAll(String selector) {
        List<BrowserElement> out = new ArrayList<>();
        for (ElementHandle handle : page.querySelectorAll(selector)) {
            out.add(new PlaywrightElement(handle));
        }
        return out;
    }

    @Override
    public String content() {
        return page.content();
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser cleanly", e);
        } finally {
            playwright.close();
        }
    }

    private static String firstLine(String message) {
        if (message == null || message.isBlank()) {
            return "navigation_error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message.trim() : message.substring(0, newline).trim();
    }

    private record PlaywrightElement(ElementHandle handle) implements BrowserElement {
        @Override
        public String attribute(String name) {
            return handle.getAttribute(name);
        }

        @Override
        public String textContent() {
            return handle.textContent();
        }
    }
}
