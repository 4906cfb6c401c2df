package com.spa.aggregator.crawl.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.pager.CatalogFilters;
import com.spa.aggregator.crawl.pager.CatalogPage;
import com.spa.aggregator.crawl.pager.CatalogQuery;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpCatalogProviderTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private AggregatorProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new AggregatorProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.getCatalog().setBaseUrl(server.url("/").toString());
        properties.getCatalog().setProductsPath("/rfb-api/products");
        properties.getCatalog().setApiToken("test-token");
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void postsSearchPayloadWithBearerToken() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"products":[{"identifiers":{"isin":"CH1111111111"}},{"identifiers":{"isin":"CH2222222222"}}],
                 "searchMetadata":{"totalHits":42}}
                """));
        CatalogQuery query = new CatalogQuery("AB", new CatalogFilters(List.of("Barrier Reverse Convertible"), null, List.of("CHF")));

        CatalogPage<JsonNode> page = provider().fetchPage(query, 20, 10);

        assertThat(page.totalHits()).isEqualTo(42);
        assertThat(page.items()).extracting(item -> item.path("identifiers").path("isin").asText())
            .containsExactly("CH1111111111", "CH2222222222");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/rfb-api/products");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-token");
        JsonNode payload = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(payload.path("pagination").path("resultsOffset").asInt()).isEqualTo(20);
        assertThat(payload.path("pagination").path("resultPerPage").asInt()).isEqualTo(10);
        assertThat(payload.path("omni").asText()).isEqualTo("AB");
        assertThat(payload.path("currencies").get(0).asText()).isEqualTo("CHF");
        assertThat(payload.path("productTypes").get(0).asText()).isEqualTo("Barrier Reverse Convertible");
    }

    @Test
    void probeCountReadsTotalHitsFromSingleItemPage() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"products\":[],\"searchMetadata\":{\"totalHits\":9999}}"));

        long count = provider().probeCount(CatalogQuery.root(CatalogFilters.none()));

        assertThat(count).isEqualTo(9999);
        JsonNode payload = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(payload.path("pagination").path("resultPerPage").asInt()).isEqualTo(1);
        assertThat(payload.path("omni").asText()).isEmpty();
    }

    @Test
    void classifiesHttpFailures() {
        server.enqueue(new MockResponse().setResponseCode(401));
        server.enqueue(new MockResponse().setResponseCode(503));
        HttpCatalogProvider provider = provider();
        CatalogQuery query = CatalogQuery.root(CatalogFilters.none());

        assertThatThrownBy(() -> provider.fetchPage(query, 0, 10))
            .isInstanceOfSatisfying(CatalogFetchException.class, e -> {
                assertThat(e.kind()).isEqualTo(FetchErrorKind.AUTH_INVALID);
                assertThat(e.errorKey()).isEqualTo("fetch_auth_invalid");
            });
        assertThatThrownBy(() -> provider.fetchPage(query, 0, 10))
            .isInstanceOfSatisfying(CatalogFetchException.class, e -> assertThat(e.kind()).isEqualTo(FetchErrorKind.TRANSIENT));
    }

    @Test
    void rateLimitIsReportedAsRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> provider().fetchPage(CatalogQuery.root(CatalogFilters.none()), 0, 10))
            .isInstanceOfSatisfying(CatalogFetchException.class, e -> assertThat(e.kind()).isEqualTo(FetchErrorKind.RATE_LIMITED));
    }

    @Test
    void malformedBodyIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> provider().fetchPage(CatalogQuery.root(CatalogFilters.none()), 0, 10))
            .isInstanceOfSatisfying(CatalogFetchException.class, e -> assertThat(e.kind()).isEqualTo(FetchErrorKind.PERMANENT));
    }

    @Test
    void missingTokenFailsWithoutSendingRequest() {
        properties.getCatalog().setApiToken(" ");

        assertThatThrownBy(() -> provider().fetchPage(CatalogQuery.root(CatalogFilters.none()), 0, 10))
            .isInstanceOfSatisfying(CatalogFetchException.class, e -> {
                assertThat(e.kind()).isEqualTo(FetchErrorKind.AUTH_INVALID);
                assertThat(e.getMessage()).contains("catalog_api_token");
            });
        assertThat(server.getRequestCount()).isZero();
    }

    private HttpCatalogProvider provider() {
        return new HttpCatalogProvider(new PoliteHttpClient(properties, executor), properties, objectMapper);
    }
}
