package com.spa.aggregator.product.model;

import java.util.Locale;

import static com.spa.aggregator.product.model.ValueKind.NUMBER;
import static com.spa.aggregator.product.model.ValueKind.TEXT;

public enum UnderlyingAttribute {
    NAME(TEXT),
    ISIN(TEXT),
    BLOOMBERG_TICKER(TEXT),
    RIC_CODE(TEXT),
    EXCHANGE(TEXT),
    REFERENCE_CURRENCY(TEXT),
    INITIAL_LEVEL(NUMBER),
    STRIKE_LEVEL(NUMBER),
    STRIKE_PCT_OF_INITIAL(NUMBER),
    BARRIER_LEVEL(NUMBER),
    BARRIER_PCT_OF_INITIAL(NUMBER),
    WEIGHT_PCT(NUMBER);

    private final ValueKind kind;
    private final String key;

    UnderlyingAttribute(ValueKind kind) {
        this.kind = kind;
        this.key = name().toLowerCase(Locale.ROOT);
    }

    public ValueKind kind() {
        return kind;
    }

    public String key() {
        return key;
    }
}
