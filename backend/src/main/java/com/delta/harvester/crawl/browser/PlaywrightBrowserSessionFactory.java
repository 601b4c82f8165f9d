package com.delta.harvester.crawl.browser;

import com.delta.harvester.config.HarvesterProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSessionFactory.class);

    private final HarvesterProperties properties;

    public PlaywrightBrowserSessionFactory(HarvesterProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSession open() {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            HarvesterProperties.Browser settings = properties.getBrowser();
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(settings.isHeadless()));
            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
            if (settings.getUserAgent() != null) {
                contextOptions.setUserAgent(settings.getUserAgent());
            }
            BrowserContext context = browser.newContext(contextOptions);
            Page page = context.newPage();
            log.info("Browser session started (headless={})", settings.isHeadless());
            return new PlaywrightBrowserSession(playwright, browser, context, page);
        } catch (RuntimeException e) {
            if (playwright != null) {
                playwright.close();
            }
            throw new BrowserSessionException("Failed to start browser session", e);
        }
    }
}
