package com.spa.aggregator.crawl.service;

import com.spa.aggregator.crawl.model.CrawlRunStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalRunTransitionException extends RuntimeException {
    private final long runId;
    private final CrawlRunStatus from;
    private final CrawlRunStatus to;

    public IllegalRunTransitionException(long runId, CrawlRunStatus from, CrawlRunStatus to) {
        super("Crawl run " + runId + " cannot move from " + from.dbValue() + " to " + to.dbValue());
        this.runId = runId;
        this.from = from;
        this.to = to;
    }

    public long runId() {
        return runId;
    }

    public CrawlRunStatus from() {
        return from;
    }

    public CrawlRunStatus to() {
        return to;
    }
}
