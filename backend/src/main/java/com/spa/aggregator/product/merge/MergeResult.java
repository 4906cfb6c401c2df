package com.spa.aggregator.product.merge;

import com.spa.aggregator.product.model.AuditEntry;
import com.spa.aggregator.product.model.NormalizedProduct;

import java.util.List;

/**
 * @param merged     the merged record; its audit trail already contains {@code newEntries}
 * @param newEntries audit entries appended by this merge, in attribute order
 * @param changed    whether any attribute or list of the primary was replaced or filled
 */
public record MergeResult(NormalizedProduct merged, List<AuditEntry> newEntries, boolean changed) {
    public MergeResult {
        newEntries = newEntries == null ? List.of() : List.copyOf(newEntries);
    }
}
