package com.spa.aggregator.product.model;

/**
 * A single attribute value with the confidence and provenance it was extracted with.
 * A field whose value is {@code null} is absent regardless of its confidence.
 */
public record Field<T>(T value, double confidence, String source, String evidence) {
    public static final String UNKNOWN_SOURCE = "unknown";

    private static final Field<?> EMPTY = new Field<>(null, 0.0, UNKNOWN_SOURCE, null);

    public Field {
        if (Double.isNaN(confidence) || confidence < 0.0) {
            confidence = 0.0;
        } else if (confidence > 1.0) {
            confidence = 1.0;
        }
        if (source == null || source.isBlank()) {
            source = UNKNOWN_SOURCE;
        }
    }

    @SuppressWarnings("unchecked")
    public static <T> Field<T> empty() {
        return (Field<T>) EMPTY;
    }

    public static <T> Field<T> of(T value, double confidence, String source) {
        return new Field<>(value, confidence, source, null);
    }

    public static <T> Field<T> of(T value, double confidence, String source, String evidence) {
        return new Field<>(value, confidence, source, evidence);
    }

    public boolean isPresent() {
        return value != null;
    }
}
