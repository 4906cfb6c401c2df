package com.spa.aggregator.crawl.util;

import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.model.HttpFetchResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FetchErrorClassifierTest {

    @Test
    void mapsHttpStatusToKind() {
        assertThat(FetchErrorClassifier.fromHttpStatus(401)).isEqualTo(FetchErrorKind.AUTH_INVALID);
        assertThat(FetchErrorClassifier.fromHttpStatus(403)).isEqualTo(FetchErrorKind.AUTH_INVALID);
        assertThat(FetchErrorClassifier.fromHttpStatus(404)).isEqualTo(FetchErrorKind.NOT_FOUND);
        assertThat(FetchErrorClassifier.fromHttpStatus(408)).isEqualTo(FetchErrorKind.TRANSIENT);
        assertThat(FetchErrorClassifier.fromHttpStatus(429)).isEqualTo(FetchErrorKind.RATE_LIMITED);
        assertThat(FetchErrorClassifier.fromHttpStatus(503)).isEqualTo(FetchErrorKind.TRANSIENT);
        assertThat(FetchErrorClassifier.fromHttpStatus(400)).isEqualTo(FetchErrorKind.PERMANENT);
    }

    @Test
    void networkErrorsAreTransient() {
        HttpFetchResult timeout = new HttpFetchResult(
            "https://example.test/p",
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.ZERO,
            "timeout",
            "request timed out"
        );

        CatalogFetchException exception = FetchErrorClassifier.toException(timeout, "detail page CH0000000001");

        assertThat(FetchErrorClassifier.classify(timeout)).isEqualTo(FetchErrorKind.TRANSIENT);
        assertThat(exception.kind()).isEqualTo(FetchErrorKind.TRANSIENT);
        assertThat(exception.getMessage()).contains("detail page CH0000000001").contains("timeout");
        assertThat(FetchErrorClassifier.fromErrorCode("invalid_url")).isEqualTo(FetchErrorKind.PERMANENT);
    }

    @Test
    void contentHashIsStablePerSourceAndKey() {
        assertThat(HashUtils.contentHash("catalog_api", "CH0000000001"))
            .isEqualTo(HashUtils.sha256Hex("catalog_api:CH0000000001"))
            .hasSize(64)
            .isNotEqualTo(HashUtils.contentHash("detail_html", "CH0000000001"));
    }
}
