package com.spa.aggregator.product.merge;

import com.spa.aggregator.product.model.AuditEntry;
import com.spa.aggregator.product.model.Field;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.ProductListAttribute;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Combines two records describing the same product.
 * <ul>
 *   <li>List attributes are taken from the secondary only when the primary's list is empty.</li>
 *   <li>Absent primary attributes are filled from the secondary without an audit entry.</li>
 *   <li>Conflicting values are overridden only for attributes in {@code preferSecondary},
 *       which appends an audit entry.</li>
 * </ul>
 * The primary's {@code id} is kept. Inputs are not modified.
 */
public final class ProductMerger {

    private ProductMerger() {
    }

    public static MergeResult merge(NormalizedProduct primary, NormalizedProduct secondary) {
        return merge(primary, secondary, Set.of());
    }

    public static MergeResult merge(
        NormalizedProduct primary,
        NormalizedProduct secondary,
        Set<ProductAttribute> preferSecondary
    ) {
        Objects.requireNonNull(primary, "primary");
        if (secondary == null) {
            return new MergeResult(primary, List.of(), false);
        }
        Set<ProductAttribute> allowList = preferSecondary == null || preferSecondary.isEmpty()
            ? EnumSet.noneOf(ProductAttribute.class)
            : EnumSet.copyOf(preferSecondary);

        NormalizedProduct.Builder builder = primary.toBuilder();
        List<AuditEntry> newEntries = new ArrayList<>();
        boolean changed = false;

        for (ProductListAttribute attribute : ProductListAttribute.values()) {
            List<?> primaryList = primary.list(attribute);
            List<?> secondaryList = secondary.list(attribute);
            if (primaryList.isEmpty() && !secondaryList.isEmpty()) {
                builder.list(attribute, secondaryList);
                changed = true;
            }
        }

        for (ProductAttribute attribute : ProductAttribute.values()) {
            Field<?> primaryField = primary.get(attribute);
            Field<?> secondaryField = secondary.get(attribute);
            if (!secondaryField.isPresent()) {
                continue;
            }
            if (!primaryField.isPresent()) {
                builder.field(attribute, secondaryField);
                changed = true;
                continue;
            }
            if (allowList.contains(attribute) && !Objects.equals(primaryField.value(), secondaryField.value())) {
                builder.field(attribute, secondaryField);
                AuditEntry entry = new AuditEntry(
                    attribute.key(),
                    primaryField.source(),
                    secondaryField.source(),
                    AuditEntry.REASON_HIGHER_CONFIDENCE
                );
                newEntries.add(entry);
                builder.appendAudit(entry);
                changed = true;
            }
        }

        return new MergeResult(builder.id(primary.id()).build(), newEntries, changed);
    }

    /**
     * Resolves configured attribute keys; unknown keys are ignored.
     */
    public static Set<ProductAttribute> attributesFromKeys(Iterable<String> keys) {
        Set<ProductAttribute> attributes = EnumSet.noneOf(ProductAttribute.class);
        if (keys == null) {
            return attributes;
        }
        for (String key : keys) {
            if (key != null) {
                ProductAttribute.fromKey(key.toLowerCase(Locale.ROOT)).ifPresent(attributes::add);
            }
        }
        return attributes;
    }
}
