package com.spa.aggregator.crawl.api;

import com.spa.aggregator.crawl.model.AutoEnrichmentStatus;
import com.spa.aggregator.crawl.model.BatchResult;
import com.spa.aggregator.crawl.model.EnrichmentCheckpoint;
import com.spa.aggregator.crawl.service.AutoEnrichmentService;
import com.spa.aggregator.crawl.service.EnrichmentService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/enrich")
public class EnrichmentController {
    private final EnrichmentService enrichmentService;
    private final AutoEnrichmentService autoEnrichmentService;

    public EnrichmentController(EnrichmentService enrichmentService, AutoEnrichmentService autoEnrichmentService) {
        this.enrichmentService = enrichmentService;
        this.autoEnrichmentService = autoEnrichmentService;
    }

    @PostMapping("/cycle")
    public BatchResult runCycle(@RequestParam(name = "batchSize", required = false) Integer batchSize) {
        return enrichmentService.runTrackedCycle(batchSize);
    }

    @PostMapping("/auto/start")
    public AutoEnrichmentStatus startAuto(@RequestParam(name = "batchSize", required = false) Integer batchSize) {
        return autoEnrichmentService.start(batchSize);
    }

    @PostMapping("/auto/stop")
    public AutoEnrichmentStatus stopAuto() {
        return autoEnrichmentService.stop();
    }

    @GetMapping("/auto/status")
    public AutoEnrichmentStatus autoStatus() {
        return autoEnrichmentService.status();
    }

    @PostMapping("/auto/reset")
    public EnrichmentCheckpoint resetAuto() {
        return autoEnrichmentService.reset();
    }
}
