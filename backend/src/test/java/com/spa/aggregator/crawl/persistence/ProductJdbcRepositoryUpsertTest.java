package com.spa.aggregator.crawl.persistence;

import com.spa.aggregator.crawl.model.EnrichmentCandidate;
import com.spa.aggregator.crawl.model.EnrichmentFilterMode;
import com.spa.aggregator.crawl.model.ProductListQuery;
import com.spa.aggregator.crawl.model.ProductRecord;
import com.spa.aggregator.crawl.model.ReviewStatus;
import com.spa.aggregator.crawl.model.UpsertOutcome;
import com.spa.aggregator.crawl.util.HashUtils;
import com.spa.aggregator.product.model.Field;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.Underlying;
import com.spa.aggregator.product.model.UnderlyingAttribute;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ProductJdbcRepositoryUpsertTest {

    @Autowired
    private ProductJdbcRepository repository;

    @Test
    void reUpsertKeepsIdAndReviewStatus() {
        String isin = randomIsin();
        String hash = HashUtils.contentHash("catalog_api", isin);
        UpsertOutcome first = repository.upsert(hash, "catalog_api", product(isin, null, false), "{}", "raw/a.json", Instant.now());
        assertTrue(first.inserted());
        assertTrue(repository.updateReviewStatus(first.id(), ReviewStatus.REVIEWED, Instant.now()));

        UpsertOutcome second = repository.upsert(hash, "catalog_api", product(isin, 5.5, false), "{}", null, Instant.now());

        assertFalse(second.inserted());
        assertEquals(first.id(), second.id());
        ProductRecord stored = repository.findById(first.id());
        assertEquals("reviewed", stored.reviewStatus());
        assertEquals(5.5, stored.couponRatePctPa());
        assertEquals("raw/a.json", stored.sourceFilePath());
        assertEquals(first.id(), repository.findProduct(first.id()).id());
    }

    @Test
    void updateNormalizedRefreshesDenormalizedColumns() {
        String isin = randomIsin();
        UpsertOutcome outcome = repository.upsert(
            HashUtils.contentHash("catalog_api", isin), "catalog_api", product(isin, null, false), null, null, Instant.now()
        );

        assertTrue(repository.updateNormalized(outcome.id(), product(isin, 8.0, true), Instant.now()));

        ProductRecord stored = repository.findById(outcome.id());
        assertEquals(8.0, stored.couponRatePctPa());
        assertTrue(stored.barrierPresent());
        assertEquals(8.0, repository.findProduct(outcome.id()).number(ProductAttribute.COUPON_RATE_PCT_PA).value());
        assertFalse(repository.updateNormalized("missing-id", product(isin, 1.0, false), Instant.now()));
    }

    @Test
    void enrichmentCandidatesFollowFilterMode() {
        String missingBoth = randomIsin();
        String missingBarrier = randomIsin();
        String complete = randomIsin();
        Instant now = Instant.now();
        repository.upsert(HashUtils.contentHash("t", missingBoth), "t", product(missingBoth, null, false), null, null, now);
        repository.upsert(HashUtils.contentHash("t", missingBarrier), "t", product(missingBarrier, 4.0, false), null, null, now.plusMillis(1));
        repository.upsert(HashUtils.contentHash("t", complete), "t", product(complete, 4.0, true), null, null, now.plusMillis(2));
        repository.upsert(HashUtils.contentHash("t", "no-isin"), "t", NormalizedProduct.empty(), null, null, now.plusMillis(3));

        assertEquals(List.of(missingBoth, missingBarrier), isins(EnrichmentFilterMode.MISSING_ANY, 10, 0));
        assertEquals(List.of(missingBoth), isins(EnrichmentFilterMode.MISSING_COUPON, 10, 0));
        assertEquals(List.of(missingBoth, missingBarrier, complete), isins(EnrichmentFilterMode.ALL_WITH_ISIN, 10, 0));
        assertEquals(List.of(missingBarrier), isins(EnrichmentFilterMode.ALL_WITH_ISIN, 1, 1));
    }

    @Test
    void listFiltersAndCounts() {
        String isin = randomIsin();
        repository.upsert(HashUtils.contentHash("catalog_api", isin), "catalog_api", product(isin, 3.0, false), null, null, Instant.now());
        ProductListQuery query = new ProductListQuery(null, null, "CHF", "pending", isin.toLowerCase(), 10, 0);

        List<ProductRecord> rows = repository.list(query);

        assertEquals(1, rows.size());
        assertEquals(isin, rows.get(0).isin());
        assertEquals(1, repository.count(query));
        assertNull(repository.findById(UUID.randomUUID().toString()));
    }

    private List<String> isins(EnrichmentFilterMode mode, int limit, int offset) {
        return repository.findEnrichmentCandidates(mode, limit, offset).stream()
            .map(EnrichmentCandidate::isin)
            .toList();
    }

    private static NormalizedProduct product(String isin, Double coupon, boolean barrier) {
        NormalizedProduct.Builder builder = NormalizedProduct.builder()
            .field(ProductAttribute.ISIN, isin, 0.9, "catalog_api")
            .field(ProductAttribute.CURRENCY, "CHF", 0.9, "catalog_api");
        if (coupon != null) {
            builder.field(ProductAttribute.COUPON_RATE_PCT_PA, coupon, 0.8, "catalog_api");
        }
        if (barrier) {
            builder.underlyings(List.of(Underlying.empty().with(
                UnderlyingAttribute.BARRIER_PCT_OF_INITIAL,
                Field.of(60.0, 0.8, "catalog_api")
            )));
        }
        return builder.build();
    }

    private static String randomIsin() {
        return "CH" + UUID.randomUUID().toString().replace("-", "").substring(0, 10).toUpperCase();
    }
}
