package com.spa.aggregator.crawl.persistence;

public class StorageConflictException extends RuntimeException {
    public StorageConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
