package com.spa.aggregator.crawl.util;

import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.model.HttpFetchResult;

import java.util.Locale;

public final class FetchErrorClassifier {

    private FetchErrorClassifier() {
    }

    public static FetchErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return FetchErrorKind.AUTH_INVALID;
        }
        if (status == 404 || status == 410) {
            return FetchErrorKind.NOT_FOUND;
        }
        if (status == 408 || (status >= 500 && status < 600)) {
            return FetchErrorKind.TRANSIENT;
        }
        if (status == 429) {
            return FetchErrorKind.RATE_LIMITED;
        }
        return FetchErrorKind.PERMANENT;
    }

    public static FetchErrorKind fromErrorCode(String errorCode) {
        if (errorCode == null || errorCode.isBlank()) {
            return FetchErrorKind.PERMANENT;
        }
        String code = errorCode.toLowerCase(Locale.ROOT);
        if (code.contains("timeout") || code.contains("io_error")) {
            return FetchErrorKind.TRANSIENT;
        }
        return FetchErrorKind.PERMANENT;
    }

    /**
     * Returns {@code null} for a successful result.
     */
    public static FetchErrorKind classify(HttpFetchResult result) {
        if (result == null) {
            return FetchErrorKind.TRANSIENT;
        }
        if (result.isSuccessful()) {
            return null;
        }
        if (result.errorCode() != null) {
            return fromErrorCode(result.errorCode());
        }
        return fromHttpStatus(result.statusCode());
    }

    public static CatalogFetchException toException(HttpFetchResult result, String context) {
        FetchErrorKind kind = classify(result);
        if (kind == null) {
            throw new IllegalArgumentException("Result is successful: " + context);
        }
        int status = result == null ? 0 : result.statusCode();
        String detail = result == null
            ? "no response"
            : result.errorCode() != null ? result.errorCode() + ": " + result.errorMessage() : "HTTP " + status;
        return new CatalogFetchException(kind, status, context + " failed (" + detail + ")", null);
    }
}
