package com.delta.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private Listing listing = new Listing();
    private Scroll scroll = new Scroll();
    private Browser browser = new Browser();
    private Capture capture = new Capture();
    private Enrichment enrichment = new Enrichment();
    private Output output = new Output();
    private Cli cli = new Cli();

    public Listing getListing() {
        return listing;
    }

    public void setListing(Listing listing) {
        this.listing = listing;
    }

    public Scroll getScroll() {
        return scroll;
    }

    public void setScroll(Scroll scroll) {
        this.scroll = scroll;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Capture getCapture() {
        return capture;
    }

    public void setCapture(Capture capture) {
        this.capture = capture;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    private static List<String> lowerCaseTrimmed(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            out.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    public static class Listing {
        private String url = "https://www.ycombinator.com/companies?batch=Summer%202025";
        private String linkSelector = "a[href*='/companies/']";
        private String recordPathPrefix = "/companies/";
        private List<String> reservedSlugs = new ArrayList<>(List.of("founders", "industry", "location", "batch"));
        private List<String> navigationLabels = new ArrayList<>(List.of("founder directory", "companies", "about", "contact"));

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url == null ? null : url.trim();
        }

        public String getLinkSelector() {
            return linkSelector;
        }

        public void setLinkSelector(String linkSelector) {
            this.linkSelector = linkSelector;
        }

        public String getRecordPathPrefix() {
            String prefix = recordPathPrefix == null || recordPathPrefix.isBlank() ? "/" : recordPathPrefix.trim();
            if (!prefix.startsWith("/")) {
                prefix = "/" + prefix;
            }
            return prefix.endsWith("/") ? prefix : prefix + "/";
        }

        public void setRecordPathPrefix(String recordPathPrefix) {
            this.recordPathPrefix = recordPathPrefix;
        }

        public List<String> getReservedSlugs() {
            return lowerCaseTrimmed(reservedSlugs);
        }

        public void setReservedSlugs(List<String> reservedSlugs) {
            this.reservedSlugs = reservedSlugs;
        }

        public List<String> getNavigationLabels() {
            return lowerCaseTrimmed(navigationLabels);
        }

        public void setNavigationLabels(List<String> navigationLabels) {
            this.navigationLabels = navigationLabels;
        }
    }

    public static class Scroll {
        private int stabilityRounds = 3;
        private int maxAttempts = 60;
        private long delayMs = 2000;
        private long listingSettleDelayMs = 3000;

        public int getStabilityRounds() {
            return Math.max(1, stabilityRounds);
        }

        public void setStabilityRounds(int stabilityRounds) {
            this.stabilityRounds = Math.max(1, stabilityRounds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getDelayMs() {
            return Math.max(0, delayMs);
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = Math.max(0, delayMs);
        }

        public long getListingSettleDelayMs() {
            return Math.max(0, listingSettleDelayMs);
        }

        public void setListingSettleDelayMs(long listingSettleDelayMs) {
            this.listingSettleDelayMs = Math.max(0, listingSettleDelayMs);
        }
    }

    public static class Browser {
        private boolean headless = true;
        private String userAgent;
        private int pageTimeoutMs = 30000;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getUserAgent() {
            return userAgent == null || userAgent.isBlank() ? null : userAgent.trim();
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getPageTimeoutMs() {
            return Math.max(1000, pageTimeoutMs);
        }

        public void setPageTimeoutMs(int pageTimeoutMs) {
            this.pageTimeoutMs = Math.max(1000, pageTimeoutMs);
        }
    }

    public static class Capture {
        private int minExpectedRecords = 100;
        private int targetRecordUpperBound = 200;
        private int progressSaveInterval = 10;

        public int getMinExpectedRecords() {
            return Math.max(0, minExpectedRecords);
        }

        public void setMinExpectedRecords(int minExpectedRecords) {
            this.minExpectedRecords = Math.max(0, minExpectedRecords);
        }

        public int getTargetRecordUpperBound() {
            return Math.max(1, targetRecordUpperBound);
        }

        public void setTargetRecordUpperBound(int targetRecordUpperBound) {
            this.targetRecordUpperBound = Math.max(1, targetRecordUpperBound);
        }

        public int getProgressSaveInterval() {
            return Math.max(1, progressSaveInterval);
        }

        public void setProgressSaveInterval(int progressSaveInterval) {
            this.progressSaveInterval = Math.max(1, progressSaveInterval);
        }
    }

    public static class Enrichment {
        private int chunkSize = 3;
        private int companyPageTimeoutMs = 15000;
        private long pageSettleDelayMs = 2000;
        private long chunkDelayMs = 1000;

        public int getChunkSize() {
            return Math.max(1, chunkSize);
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = Math.max(1, chunkSize);
        }

        public int getCompanyPageTimeoutMs() {
            return Math.max(1000, companyPageTimeoutMs);
        }

        public void setCompanyPageTimeoutMs(int companyPageTimeoutMs) {
            this.companyPageTimeoutMs = Math.max(1000, companyPageTimeoutMs);
        }

        public long getPageSettleDelayMs() {
            return Math.max(0, pageSettleDelayMs);
        }

        public void setPageSettleDelayMs(long pageSettleDelayMs) {
            this.pageSettleDelayMs = Math.max(0, pageSettleDelayMs);
        }

        public long getChunkDelayMs() {
            return Math.max(0, chunkDelayMs);
        }

        public void setChunkDelayMs(long chunkDelayMs) {
            this.chunkDelayMs = Math.max(0, chunkDelayMs);
        }
    }

    public static class Output {
        private String directory = ".";
        private String filePrefix = "companies";

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "." : directory.trim();
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getFilePrefix() {
            return filePrefix == null || filePrefix.isBlank() ? "companies" : filePrefix.trim();
        }

        public void setFilePrefix(String filePrefix) {
            this.filePrefix = filePrefix;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
