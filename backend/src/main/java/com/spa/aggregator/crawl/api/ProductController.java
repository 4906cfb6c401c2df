package com.spa.aggregator.crawl.api;

import com.spa.aggregator.crawl.model.ProductDetailView;
import com.spa.aggregator.crawl.model.ProductListQuery;
import com.spa.aggregator.crawl.model.ProductPageResponse;
import com.spa.aggregator.crawl.model.ProductRecord;
import com.spa.aggregator.crawl.model.ReviewStatus;
import com.spa.aggregator.crawl.service.ProductQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/products")
public class ProductController {
    private final ProductQueryService productQueryService;

    public ProductController(ProductQueryService productQueryService) {
        this.productQueryService = productQueryService;
    }

    @GetMapping
    public ProductPageResponse list(
        @RequestParam(name = "sourceKind", required = false) String sourceKind,
        @RequestParam(name = "productType", required = false) String productType,
        @RequestParam(name = "currency", required = false) String currency,
        @RequestParam(name = "reviewStatus", required = false) String reviewStatus,
        @RequestParam(name = "q", required = false) String search,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit,
        @RequestParam(name = "offset", required = false, defaultValue = "0") int offset
    ) {
        String status = reviewStatus == null || reviewStatus.isBlank()
            ? null
            : ReviewStatus.parse(reviewStatus).dbValue();
        return productQueryService.list(
            new ProductListQuery(sourceKind, productType, currency, status, search, limit, offset)
        );
    }

    @GetMapping("/{productId}")
    public ProductDetailView detail(@PathVariable("productId") String productId) {
        return productQueryService.detail(productId);
    }

    @PostMapping("/{productId}/review")
    public ProductRecord review(
        @PathVariable("productId") String productId,
        @RequestParam(name = "status") String status
    ) {
        return productQueryService.review(productId, ReviewStatus.parse(status));
    }
}
