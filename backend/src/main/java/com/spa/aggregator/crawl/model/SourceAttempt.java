package com.spa.aggregator.crawl.model;

/**
 * One detail-source lookup made while enriching a product.
 */
public record SourceAttempt(String source, boolean yieldedData, String errorKey, String message) {

    public static SourceAttempt success(String source) {
        return new SourceAttempt(source, true, null, null);
    }

    public static SourceAttempt empty(String source) {
        return new SourceAttempt(source, false, "no_data", null);
    }

    public static SourceAttempt failure(String source, String errorKey, String message) {
        return new SourceAttempt(source, false, errorKey, message);
    }

    public String describe() {
        if (yieldedData) {
            return source + ":ok";
        }
        return message == null ? source + ":" + errorKey : source + ":" + errorKey + " (" + message + ")";
    }
}
