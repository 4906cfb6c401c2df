package com.spa.aggregator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    private static final String DEFAULT_USER_AGENT = "spa-aggregator/0.1 (+contact)";
    static final String DEFAULT_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private String userAgent;
    private int perHostDelayMs = 100;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 30;
    private Catalog catalog = new Catalog();
    private Retry retry = new Retry();
    private Enrichment enrichment = new Enrichment();
    private Runs runs = new Runs();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
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

    public static class Catalog {
        private boolean enabled = true;
        private String baseUrl = "https://structuredproducts-ch.leonteq.com";
        private String productsPath = "/rfb-api/products";
        private String apiToken;
        private String region = "CH";
        private int pageSize = 50;
        private int windowCeiling = 10_000;
        private String alphabet = DEFAULT_ALPHABET;
        private int maxDepth = 6;
        private int rateLimitMs = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getProductsPath() {
            return productsPath;
        }

        public void setProductsPath(String productsPath) {
            this.productsPath = productsPath;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public boolean hasApiToken() {
            return apiToken != null && !apiToken.isBlank();
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getWindowCeiling() {
            return Math.max(1, windowCeiling);
        }

        public void setWindowCeiling(int windowCeiling) {
            this.windowCeiling = Math.max(1, windowCeiling);
        }

        public String getAlphabet() {
            return alphabet == null || alphabet.isBlank() ? DEFAULT_ALPHABET : alphabet;
        }

        public void setAlphabet(String alphabet) {
            this.alphabet = alphabet;
        }

        public int getMaxDepth() {
            return Math.max(1, maxDepth);
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = Math.max(1, maxDepth);
        }

        public int getRateLimitMs() {
            return Math.max(0, rateLimitMs);
        }

        public void setRateLimitMs(int rateLimitMs) {
            this.rateLimitMs = Math.max(0, rateLimitMs);
        }

        public String productsUrl() {
            String base = baseUrl == null ? "" : baseUrl.trim();
            if (base.endsWith("/")) {
                base = base.substring(0, base.length() - 1);
            }
            String path = productsPath == null ? "" : productsPath.trim();
            if (!path.isEmpty() && !path.startsWith("/")) {
                path = "/" + path;
            }
            return base + path;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int transientBackoffMs = 5000;
        private int rateLimitedBackoffMs = 30_000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getTransientBackoffMs() {
            return Math.max(0, transientBackoffMs);
        }

        public void setTransientBackoffMs(int transientBackoffMs) {
            this.transientBackoffMs = Math.max(0, transientBackoffMs);
        }

        public int getRateLimitedBackoffMs() {
            return Math.max(0, rateLimitedBackoffMs);
        }

        public void setRateLimitedBackoffMs(int rateLimitedBackoffMs) {
            this.rateLimitedBackoffMs = Math.max(0, rateLimitedBackoffMs);
        }
    }

    public static class Enrichment {
        private String checkpointPath = "data/auto_enrich_state.json";
        private int workers = 3;
        private int perItemDelayMs = 500;
        private int defaultBatchSize = 50;
        private int cycleDelaySeconds = 60;
        private int errorSampleSize = 20;
        private String filterMode = "MISSING_ANY";
        private String detailBaseUrl = "https://www.finanzen.ch/derivate";
        private List<String> preferSecondaryFields = new ArrayList<>(
            List.of("coupon_rate_pct_pa", "cap_level_pct", "participation_rate_pct")
        );

        public String getCheckpointPath() {
            return checkpointPath;
        }

        public void setCheckpointPath(String checkpointPath) {
            this.checkpointPath = checkpointPath;
        }

        public int getWorkers() {
            return Math.max(1, workers);
        }

        public void setWorkers(int workers) {
            this.workers = Math.max(1, workers);
        }

        public int getPerItemDelayMs() {
            return Math.max(0, perItemDelayMs);
        }

        public void setPerItemDelayMs(int perItemDelayMs) {
            this.perItemDelayMs = Math.max(0, perItemDelayMs);
        }

        public int getDefaultBatchSize() {
            return Math.max(1, defaultBatchSize);
        }

        public void setDefaultBatchSize(int defaultBatchSize) {
            this.defaultBatchSize = Math.max(1, defaultBatchSize);
        }

        public int getCycleDelaySeconds() {
            return Math.max(1, cycleDelaySeconds);
        }

        public void setCycleDelaySeconds(int cycleDelaySeconds) {
            this.cycleDelaySeconds = Math.max(1, cycleDelaySeconds);
        }

        public int getErrorSampleSize() {
            return Math.max(1, errorSampleSize);
        }

        public void setErrorSampleSize(int errorSampleSize) {
            this.errorSampleSize = Math.max(1, errorSampleSize);
        }

        public String getFilterMode() {
            return filterMode;
        }

        public void setFilterMode(String filterMode) {
            this.filterMode = filterMode;
        }

        public String getDetailBaseUrl() {
            return detailBaseUrl;
        }

        public void setDetailBaseUrl(String detailBaseUrl) {
            this.detailBaseUrl = detailBaseUrl;
        }

        public List<String> getPreferSecondaryFields() {
            return preferSecondaryFields;
        }

        public void setPreferSecondaryFields(List<String> preferSecondaryFields) {
            this.preferSecondaryFields = preferSecondaryFields == null ? new ArrayList<>() : preferSecondaryFields;
        }
    }

    public static class Runs {
        private int staleRunMinutes = 10;

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Cli {
        private boolean run;
        private String mode = "catalog";
        private int batchSize = 50;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
