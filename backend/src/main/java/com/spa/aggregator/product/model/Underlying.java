package com.spa.aggregator.product.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One underlying of a structured product. Immutable; {@link #with} returns a copy.
 */
public final class Underlying {
    private static final Underlying EMPTY = new Underlying(new EnumMap<>(UnderlyingAttribute.class));

    private final Map<UnderlyingAttribute, Field<?>> fields;

    private Underlying(EnumMap<UnderlyingAttribute, Field<?>> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Underlying empty() {
        return EMPTY;
    }

    public Underlying with(UnderlyingAttribute attribute, Field<?> field) {
        EnumMap<UnderlyingAttribute, Field<?>> copy = new EnumMap<>(UnderlyingAttribute.class);
        copy.putAll(fields);
        Field<?> normalized = normalize(attribute.kind(), field);
        if (!normalized.isPresent()) {
            copy.remove(attribute);
        } else {
            copy.put(attribute, normalized);
        }
        return new Underlying(copy);
    }

    public Field<?> get(UnderlyingAttribute attribute) {
        Field<?> field = fields.get(attribute);
        return field == null ? Field.empty() : field;
    }

    @SuppressWarnings("unchecked")
    public Field<String> text(UnderlyingAttribute attribute) {
        requireKind(attribute, ValueKind.TEXT);
        return (Field<String>) get(attribute);
    }

    @SuppressWarnings("unchecked")
    public Field<Double> number(UnderlyingAttribute attribute) {
        requireKind(attribute, ValueKind.NUMBER);
        return (Field<Double>) get(attribute);
    }

    public boolean isEmpty() {
        return fields.values().stream().noneMatch(Field::isPresent);
    }

    public Map<UnderlyingAttribute, Field<?>> fields() {
        return fields;
    }

    static Field<?> normalize(ValueKind kind, Field<?> field) {
        if (field == null) {
            return Field.empty();
        }
        Object coerced = kind.coerce(field.value());
        if (coerced == field.value()) {
            return field;
        }
        if (field.value() != null && coerced == null) {
            throw new IllegalArgumentException(
                "Value of type " + field.value().getClass().getSimpleName() + " is not a " + kind
            );
        }
        return new Field<>(coerced, field.confidence(), field.source(), field.evidence());
    }

    private static void requireKind(UnderlyingAttribute attribute, ValueKind kind) {
        if (attribute.kind() != kind) {
            throw new IllegalArgumentException(attribute.key() + " is " + attribute.kind() + ", not " + kind);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Underlying that)) {
            return false;
        }
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "Underlying" + fields;
    }
}
