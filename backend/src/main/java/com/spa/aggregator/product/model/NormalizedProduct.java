package com.spa.aggregator.product.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The canonical record for one structured product, assembled from one or more sources.
 * <p>
 * Instances are immutable. Use {@link #builder()} or {@link #toBuilder()} to derive new ones.
 * Equality is structural over the attributes and lists; {@code id} and the audit trail are ignored.
 */
public final class NormalizedProduct {
    private final String id;
    private final Map<ProductAttribute, Field<?>> fields;
    private final List<Underlying> underlyings;
    private final List<CouponScheduleItem> couponSchedule;
    private final List<Field<String>> callObservationDates;
    private final List<Field<String>> callSettlementDates;
    private final List<Field<String>> sellingRestrictions;
    private final List<AuditEntry> auditTrail;

    private NormalizedProduct(Builder builder) {
        this.id = builder.id;
        this.fields = Collections.unmodifiableMap(new EnumMap<>(builder.fields));
        this.underlyings = List.copyOf(builder.underlyings);
        this.couponSchedule = List.copyOf(builder.couponSchedule);
        this.callObservationDates = List.copyOf(builder.callObservationDates);
        this.callSettlementDates = List.copyOf(builder.callSettlementDates);
        this.sellingRestrictions = List.copyOf(builder.sellingRestrictions);
        this.auditTrail = List.copyOf(builder.auditTrail);
    }

    public static NormalizedProduct empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.fields.putAll(fields);
        builder.underlyings.addAll(underlyings);
        builder.couponSchedule.addAll(couponSchedule);
        builder.callObservationDates.addAll(callObservationDates);
        builder.callSettlementDates.addAll(callSettlementDates);
        builder.sellingRestrictions.addAll(sellingRestrictions);
        builder.auditTrail.addAll(auditTrail);
        return builder;
    }

    public String id() {
        return id;
    }

    public Field<?> get(ProductAttribute attribute) {
        Field<?> field = fields.get(attribute);
        return field == null ? Field.empty() : field;
    }

    @SuppressWarnings("unchecked")
    public Field<String> text(ProductAttribute attribute) {
        requireKind(attribute, ValueKind.TEXT);
        return (Field<String>) get(attribute);
    }

    @SuppressWarnings("unchecked")
    public Field<Double> number(ProductAttribute attribute) {
        requireKind(attribute, ValueKind.NUMBER);
        return (Field<Double>) get(attribute);
    }

    @SuppressWarnings("unchecked")
    public Field<Boolean> flag(ProductAttribute attribute) {
        requireKind(attribute, ValueKind.FLAG);
        return (Field<Boolean>) get(attribute);
    }

    public boolean has(ProductAttribute attribute) {
        return get(attribute).isPresent();
    }

    public List<?> list(ProductListAttribute attribute) {
        return switch (attribute) {
            case UNDERLYINGS -> underlyings;
            case COUPON_SCHEDULE -> couponSchedule;
            case CALL_OBSERVATION_DATES -> callObservationDates;
            case CALL_SETTLEMENT_DATES -> callSettlementDates;
            case SELLING_RESTRICTIONS -> sellingRestrictions;
        };
    }

    public List<Underlying> underlyings() {
        return underlyings;
    }

    public List<CouponScheduleItem> couponSchedule() {
        return couponSchedule;
    }

    public List<Field<String>> callObservationDates() {
        return callObservationDates;
    }

    public List<Field<String>> callSettlementDates() {
        return callSettlementDates;
    }

    public List<Field<String>> sellingRestrictions() {
        return sellingRestrictions;
    }

    public List<AuditEntry> auditTrail() {
        return auditTrail;
    }

    public Map<ProductAttribute, Field<?>> presentFields() {
        Map<ProductAttribute, Field<?>> present = new EnumMap<>(ProductAttribute.class);
        fields.forEach((attribute, field) -> {
            if (field.isPresent()) {
                present.put(attribute, field);
            }
        });
        return present;
    }

    /**
     * True when no attribute carries a value and every list is empty.
     */
    public boolean isEmpty() {
        if (fields.values().stream().anyMatch(Field::isPresent)) {
            return false;
        }
        for (ProductListAttribute attribute : ProductListAttribute.values()) {
            if (!list(attribute).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public boolean hasBarrier() {
        return underlyings.stream().anyMatch(underlying ->
            underlying.get(UnderlyingAttribute.BARRIER_LEVEL).isPresent()
                || underlying.get(UnderlyingAttribute.BARRIER_PCT_OF_INITIAL).isPresent()
        );
    }

    private static void requireKind(ProductAttribute attribute, ValueKind kind) {
        if (attribute.kind() != kind) {
            throw new IllegalArgumentException(attribute.key() + " is " + attribute.kind() + ", not " + kind);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NormalizedProduct that)) {
            return false;
        }
        return fields.equals(that.fields)
            && underlyings.equals(that.underlyings)
            && couponSchedule.equals(that.couponSchedule)
            && callObservationDates.equals(that.callObservationDates)
            && callSettlementDates.equals(that.callSettlementDates)
            && sellingRestrictions.equals(that.sellingRestrictions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            fields,
            underlyings,
            couponSchedule,
            callObservationDates,
            callSettlementDates,
            sellingRestrictions
        );
    }

    @Override
    public String toString() {
        return "NormalizedProduct{id=" + id
            + ", isin=" + get(ProductAttribute.ISIN).value()
            + ", fields=" + presentFields().size()
            + ", underlyings=" + underlyings.size()
            + ", auditTrail=" + auditTrail.size() + "}";
    }

    public static final class Builder {
        private String id;
        private final EnumMap<ProductAttribute, Field<?>> fields = new EnumMap<>(ProductAttribute.class);
        private final List<Underlying> underlyings = new ArrayList<>();
        private final List<CouponScheduleItem> couponSchedule = new ArrayList<>();
        private final List<Field<String>> callObservationDates = new ArrayList<>();
        private final List<Field<String>> callSettlementDates = new ArrayList<>();
        private final List<Field<String>> sellingRestrictions = new ArrayList<>();
        private final List<AuditEntry> auditTrail = new ArrayList<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Sets an attribute. Whole numbers are widened to {@link Double} for numeric attributes;
         * a value of the wrong kind is rejected.
         */
        public Builder field(ProductAttribute attribute, Field<?> field) {
            Field<?> normalized = Underlying.normalize(attribute.kind(), field);
            if (!normalized.isPresent()) {
                fields.remove(attribute);
            } else {
                fields.put(attribute, normalized);
            }
            return this;
        }

        public Builder field(ProductAttribute attribute, Object value, double confidence, String source) {
            return field(attribute, Field.of(value, confidence, source));
        }

        public Builder field(ProductAttribute attribute, Object value, double confidence, String source, String evidence) {
            return field(attribute, Field.of(value, confidence, source, evidence));
        }

        public Builder underlyings(List<Underlying> values) {
            underlyings.clear();
            if (values != null) {
                values.stream().filter(Objects::nonNull).forEach(underlyings::add);
            }
            return this;
        }

        public Builder couponSchedule(List<CouponScheduleItem> values) {
            couponSchedule.clear();
            if (values != null) {
                values.stream().filter(Objects::nonNull).forEach(couponSchedule::add);
            }
            return this;
        }

        public Builder callObservationDates(List<Field<String>> values) {
            replace(callObservationDates, values);
            return this;
        }

        public Builder callSettlementDates(List<Field<String>> values) {
            replace(callSettlementDates, values);
            return this;
        }

        public Builder sellingRestrictions(List<Field<String>> values) {
            replace(sellingRestrictions, values);
            return this;
        }

        @SuppressWarnings("unchecked")
        public Builder list(ProductListAttribute attribute, List<?> values) {
            return switch (attribute) {
                case UNDERLYINGS -> underlyings((List<Underlying>) values);
                case COUPON_SCHEDULE -> couponSchedule((List<CouponScheduleItem>) values);
                case CALL_OBSERVATION_DATES -> callObservationDates((List<Field<String>>) values);
                case CALL_SETTLEMENT_DATES -> callSettlementDates((List<Field<String>>) values);
                case SELLING_RESTRICTIONS -> sellingRestrictions((List<Field<String>>) values);
            };
        }

        public Builder auditTrail(List<AuditEntry> entries) {
            auditTrail.clear();
            if (entries != null) {
                auditTrail.addAll(entries);
            }
            return this;
        }

        public Builder appendAudit(AuditEntry entry) {
            auditTrail.add(entry);
            return this;
        }

        public NormalizedProduct build() {
            return new NormalizedProduct(this);
        }

        private static void replace(List<Field<String>> target, List<Field<String>> values) {
            target.clear();
            if (values != null) {
                values.stream().filter(Objects::nonNull).forEach(target::add);
            }
        }
    }
}
