package com.spa.aggregator.crawl.service;

import com.spa.aggregator.crawl.model.ProductDetailView;
import com.spa.aggregator.crawl.model.ProductListQuery;
import com.spa.aggregator.crawl.model.ProductPageResponse;
import com.spa.aggregator.crawl.model.ProductRecord;
import com.spa.aggregator.crawl.model.ReviewStatus;
import com.spa.aggregator.crawl.persistence.ProductJdbcRepository;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductJsonCodec;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class ProductQueryService {
    private final ProductJdbcRepository repository;
    private final ProductJsonCodec codec;

    public ProductQueryService(ProductJdbcRepository repository, ProductJsonCodec codec) {
        this.repository = repository;
        this.codec = codec;
    }

    public ProductPageResponse list(ProductListQuery query) {
        List<ProductRecord> items = repository.list(query);
        long total = repository.count(query);
        return new ProductPageResponse(items, total, query.limit(), query.offset());
    }

    public ProductDetailView detail(String productId) {
        ProductRecord record = repository.findById(productId);
        if (record == null) {
            throw new ProductNotFoundException(productId);
        }
        NormalizedProduct product = repository.findProduct(productId);
        return new ProductDetailView(record, codec.toTree(product));
    }

    public ProductRecord review(String productId, ReviewStatus status) {
        if (!repository.updateReviewStatus(productId, status, Instant.now())) {
            throw new ProductNotFoundException(productId);
        }
        return repository.findById(productId);
    }
}
