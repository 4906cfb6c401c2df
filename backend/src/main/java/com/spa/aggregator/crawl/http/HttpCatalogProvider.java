package com.spa.aggregator.crawl.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.model.HttpFetchResult;
import com.spa.aggregator.crawl.pager.CatalogPage;
import com.spa.aggregator.crawl.pager.CatalogProvider;
import com.spa.aggregator.crawl.pager.CatalogQuery;
import com.spa.aggregator.crawl.util.FetchErrorClassifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Product search of the issuer catalog API ({@code POST /rfb-api/products}).
 * Responses carry {@code products} and {@code searchMetadata.totalHits}.
 */
@Component
public class HttpCatalogProvider implements CatalogProvider<JsonNode> {
    private static final String ACCEPT_JSON = "application/json";

    private final PoliteHttpClient httpClient;
    private final AggregatorProperties properties;
    private final ObjectMapper objectMapper;

    public HttpCatalogProvider(PoliteHttpClient httpClient, AggregatorProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public CatalogPage<JsonNode> fetchPage(CatalogQuery query, int offset, int pageSize) {
        AggregatorProperties.Catalog catalog = properties.getCatalog();
        if (!catalog.hasApiToken()) {
            throw new CatalogFetchException(FetchErrorKind.AUTH_INVALID, "catalog_api_token not configured");
        }
        String body = writePayload(query, offset, pageSize);
        HttpFetchResult result = httpClient.postJson(
            catalog.productsUrl(),
            body,
            ACCEPT_JSON,
            Map.of("Authorization", "Bearer " + catalog.getApiToken().trim())
        );
        if (!result.isSuccessful()) {
            throw FetchErrorClassifier.toException(result, "catalog search '" + query.label() + "'@" + offset);
        }
        return readPage(result.body());
    }

    ObjectNode buildPayload(CatalogQuery query, int offset, int pageSize) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("region", properties.getCatalog().getRegion());
        ObjectNode pagination = payload.putObject("pagination");
        pagination.put("resultPerPage", pageSize);
        pagination.put("resultsOffset", offset);

        ArrayNode sort = payload.putArray("sort");
        addSort(sort, "underlying.shortName.keyword", "ASC");
        addSort(sort, "payoff.bearish", "ASC");
        addSort(sort, "calendar.finalFixingDate", "ASC");
        addSort(sort, "levels.strikeLevelAbs", "DESC");
        addSort(sort, "listings.markets.marketVenue", "ASC");
        addSort(sort, "price.metrics.delta", "DESC");

        ObjectNode conditions = payload.putObject("conditions");
        conditions.put("-identification.status:EXPIRED", true);
        conditions.put("+_exists_:levels.stopLossLevelAbs", false);
        conditions.put("+priceIndication.extendedTradingHours:true", false);
        conditions.put("+calendar.issueDateTime:[* TO now]", true);

        ArrayNode currencies = payload.putArray("currencies");
        query.filters().currencies().forEach(currencies::add);
        payload.putArray("underlyings");
        ArrayNode productTypes = payload.putArray("productTypes");
        query.filters().productTypes().forEach(productTypes::add);
        payload.put("omni", query.searchText());
        return payload;
    }

    private String writePayload(CatalogQuery query, int offset, int pageSize) {
        try {
            return objectMapper.writeValueAsString(buildPayload(query, offset, pageSize));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize catalog search payload", e);
        }
    }

    private CatalogPage<JsonNode> readPage(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new CatalogFetchException(FetchErrorKind.PERMANENT, 0, "catalog response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogFetchException(FetchErrorKind.PERMANENT, "catalog response is not a JSON object");
        }
        long totalHits = root.path("searchMetadata").path("totalHits").asLong(0);
        List<JsonNode> items = new ArrayList<>();
        root.path("products").forEach(items::add);
        return new CatalogPage<>(totalHits, items);
    }

    private static void addSort(ArrayNode sort, String field, String order) {
        ObjectNode node = sort.addObject();
        node.put("fieldName", field);
        node.put("sortOrder", order);
    }
}
