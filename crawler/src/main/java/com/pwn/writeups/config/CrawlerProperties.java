package com.pwn.writeups.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/71.0.3578.98 Safari/537.36";
    private static final String DEFAULT_BASE_URL = "https://ctftime.org";
    private static final String DEFAULT_INDEX_PATH = "/writeups?tags=pwn&hidden-tags=pwn";

    private String baseUrl = DEFAULT_BASE_URL;
    private String indexPath = DEFAULT_INDEX_PATH;
    private String userAgent;
    private int poolWidth = 7;
    private int maxAttempts = 15;
    private int retryBaseDelayMs = 1;
    private int requestTimeoutSeconds = 20;
    private Run run = new Run();
    private Selectors selectors = new Selectors();
    private Cli cli = new Cli();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
    }

    public String getIndexPath() {
        return indexPath;
    }

    public void setIndexPath(String indexPath) {
        this.indexPath = indexPath == null || indexPath.isBlank() ? DEFAULT_INDEX_PATH : indexPath.trim();
    }

    public String getIndexUrl() {
        return baseUrl + indexPath;
    }

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPoolWidth() {
        return Math.max(1, poolWidth);
    }

    public void setPoolWidth(int poolWidth) {
        this.poolWidth = Math.max(1, poolWidth);
    }

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public int getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Selectors getSelectors() {
        return selectors;
    }

    public void setSelectors(Selectors selectors) {
        this.selectors = selectors;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    static String normalizeBaseUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        String value = candidate.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public static class Run {
        private int maxDurationSeconds = 0;

        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }
    }

    public static class Selectors {
        private String indexTableId = "writeups_table";
        private String descriptionId = "id_description";
        private String fallbackLinkText = "Original writeup";

        public String getIndexTableId() {
            return indexTableId;
        }

        public void setIndexTableId(String indexTableId) {
            this.indexTableId = indexTableId;
        }

        public String getDescriptionId() {
            return descriptionId;
        }

        public void setDescriptionId(String descriptionId) {
            this.descriptionId = descriptionId;
        }

        public String getFallbackLinkText() {
            return fallbackLinkText;
        }

        public void setFallbackLinkText(String fallbackLinkText) {
            this.fallbackLinkText = fallbackLinkText;
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
