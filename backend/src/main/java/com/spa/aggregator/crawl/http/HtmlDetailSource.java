package com.spa.aggregator.crawl.http;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.HttpFetchResult;
import com.spa.aggregator.crawl.util.FetchErrorClassifier;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.parse.DetailPageParser;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@Order(1)
public class HtmlDetailSource implements DetailSource {
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml";

    private final PoliteHttpClient httpClient;
    private final DetailPageParser parser;
    private final AggregatorProperties properties;

    public HtmlDetailSource(PoliteHttpClient httpClient, DetailPageParser parser, AggregatorProperties properties) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.properties = properties;
    }

    @Override
    public String name() {
        return DetailPageParser.SOURCE;
    }

    @Override
    public NormalizedProduct fetch(String isin) {
        String url = detailUrl(isin);
        HttpFetchResult result = httpClient.get(url, ACCEPT_HTML);
        if (!result.isSuccessful()) {
            throw FetchErrorClassifier.toException(result, "detail page " + isin);
        }
        return parser.parse(result.body(), isin);
    }

    String detailUrl(String isin) {
        String base = properties.getEnrichment().getDetailBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + isin.trim().toLowerCase(Locale.ROOT);
    }
}
