package com.spa.aggregator.product.model;

import java.util.Map;

public enum ValueKind {
    TEXT(String.class),
    NUMBER(Double.class),
    FLAG(Boolean.class),
    MAP(Map.class);

    private final Class<?> javaType;

    ValueKind(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Coerces a raw value into this kind's Java type, or returns {@code null} when it cannot.
     * Numbers of any boxed type become {@link Double}.
     */
    public Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        if (this == NUMBER && raw instanceof Number number) {
            return number.doubleValue();
        }
        return javaType.isInstance(raw) ? raw : null;
    }
}
