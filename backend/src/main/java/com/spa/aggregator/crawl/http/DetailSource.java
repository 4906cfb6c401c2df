package com.spa.aggregator.crawl.http;

import com.spa.aggregator.product.model.NormalizedProduct;

/**
 * A per-product lookup by ISIN used to enrich stored records.
 */
public interface DetailSource {

    String name();

    /**
     * @return the parsed record, empty when the page carried nothing usable
     * @throws com.spa.aggregator.crawl.model.CatalogFetchException when the lookup itself fails
     */
    NormalizedProduct fetch(String isin);
}
