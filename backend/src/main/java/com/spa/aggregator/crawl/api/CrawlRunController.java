package com.spa.aggregator.crawl.api;

import com.spa.aggregator.crawl.model.CatalogCrawlRequest;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.service.CatalogCrawlService;
import com.spa.aggregator.crawl.service.CrawlRunRegistry;
import com.spa.aggregator.crawl.service.IllegalRunTransitionException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/crawl")
public class CrawlRunController {
    private final CatalogCrawlService catalogCrawlService;
    private final CrawlRunRegistry runRegistry;

    public CrawlRunController(CatalogCrawlService catalogCrawlService, CrawlRunRegistry runRegistry) {
        this.catalogCrawlService = catalogCrawlService;
        this.runRegistry = runRegistry;
    }

    @PostMapping("/catalog")
    public CrawlRun startCatalogCrawl(@RequestBody(required = false) CatalogCrawlRequest request) {
        return catalogCrawlService.start(request);
    }

    @GetMapping("/runs")
    public List<CrawlRun> recentRuns(@RequestParam(name = "limit", required = false, defaultValue = "50") int limit) {
        return runRegistry.recent(limit);
    }

    @GetMapping("/runs/{runId}")
    public CrawlRun run(@PathVariable("runId") long runId) {
        return runRegistry.get(runId);
    }

    @PostMapping("/runs/{runId}/pause")
    public CrawlRun pause(@PathVariable("runId") long runId) {
        return runRegistry.pause(runId);
    }

    /**
     * Catalog crawls are resubmitted from their checkpoint; auto-enrichment runs are picked up by their loop. A
     * single enrichment cycle has no owner once it stops, so it cannot be resumed.
     */
    @PostMapping("/runs/{runId}/resume")
    public CrawlRun resume(@PathVariable("runId") long runId) {
        CrawlRun run = runRegistry.get(runId);
        if (CrawlRun.CATALOG_API.equals(run.name())) {
            return catalogCrawlService.resume(runId);
        }
        if (CrawlRun.ENRICHMENT_CYCLE.equals(run.name())) {
            throw new IllegalRunTransitionException(runId, run.status(), CrawlRunStatus.RUNNING);
        }
        return runRegistry.resume(runId);
    }

    @PostMapping("/runs/{runId}/cancel")
    public CrawlRun cancel(@PathVariable("runId") long runId) {
        return runRegistry.cancel(runId);
    }
}
