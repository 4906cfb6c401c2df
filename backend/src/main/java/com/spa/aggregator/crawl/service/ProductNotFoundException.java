package com.spa.aggregator.crawl.service;

public class ProductNotFoundException extends RuntimeException {
    public ProductNotFoundException(String productId) {
        super("Product " + productId + " not found");
    }
}
