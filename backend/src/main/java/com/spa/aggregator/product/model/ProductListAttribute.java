package com.spa.aggregator.product.model;

import java.util.Locale;

/**
 * List-valued attributes of a {@link NormalizedProduct}. These are merged wholesale, never element-wise.
 */
public enum ProductListAttribute {
    UNDERLYINGS,
    COUPON_SCHEDULE,
    CALL_OBSERVATION_DATES,
    CALL_SETTLEMENT_DATES,
    SELLING_RESTRICTIONS;

    private final String key = name().toLowerCase(Locale.ROOT);

    public String key() {
        return key;
    }
}
