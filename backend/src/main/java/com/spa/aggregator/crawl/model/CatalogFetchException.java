package com.spa.aggregator.crawl.model;

import java.util.Locale;

public class CatalogFetchException extends RuntimeException {
    private final FetchErrorKind kind;
    private final int statusCode;

    public CatalogFetchException(FetchErrorKind kind, String message) {
        this(kind, 0, message, null);
    }

    public CatalogFetchException(FetchErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public FetchErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Short machine-readable key such as {@code fetch_rate_limited} or {@code fetch_http_503}.
     */
    public String errorKey() {
        if (statusCode > 0 && kind != FetchErrorKind.RATE_LIMITED && kind != FetchErrorKind.AUTH_INVALID) {
            return "fetch_http_" + statusCode;
        }
        return "fetch_" + kind.name().toLowerCase(Locale.ROOT);
    }
}
