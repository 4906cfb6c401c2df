package com.spa.aggregator.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CrawlRunNotFoundException extends RuntimeException {
    private final long runId;

    public CrawlRunNotFoundException(long runId) {
        super("Crawl run " + runId + " not found");
        this.runId = runId;
    }

    public long runId() {
        return runId;
    }
}
