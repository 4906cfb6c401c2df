package com.spa.aggregator.product.parse;

import com.spa.aggregator.product.model.NormalizedProduct;

/**
 * Builds a record from one raw source payload.
 * Implementations never throw on malformed input; they return a partially filled or empty record.
 */
public interface ProductParser<R> {

    NormalizedProduct parse(R raw, String sourceHint);
}
