package com.spa.aggregator.crawl.service;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.BatchResult;
import com.spa.aggregator.crawl.model.CatalogCrawlRequest;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.model.ItemError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@Order(10)
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final AggregatorProperties properties;
    private final CatalogCrawlService catalogCrawlService;
    private final EnrichmentService enrichmentService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        AggregatorProperties properties,
        CatalogCrawlService catalogCrawlService,
        EnrichmentService enrichmentService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.catalogCrawlService = catalogCrawlService;
        this.enrichmentService = enrichmentService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        AggregatorProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        int exitStatus;
        String mode = cli.getMode().trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "catalog" -> {
                CrawlRun run = catalogCrawlService.runBlocking(CatalogCrawlRequest.unrestricted());
                log.info(
                    "Catalog crawl {} finished with status {}: total={} completed={} errors={} lastError={}",
                    run.id(),
                    run.status().dbValue(),
                    run.total(),
                    run.completed(),
                    run.errorsCount(),
                    run.lastError()
                );
                exitStatus = run.status() == CrawlRunStatus.COMPLETED ? 0 : 1;
            }
            case "enrich" -> {
                BatchResult result = enrichmentService.runTrackedCycle(cli.getBatchSize());
                log.info(
                    "Enrichment batch finished ({}): processed={} succeeded={} failed={} offset {} -> {}",
                    result.stopReason(),
                    result.processed(),
                    result.succeeded(),
                    result.failed(),
                    result.offsetBefore(),
                    result.offsetAfter()
                );
                for (ItemError error : result.errors()) {
                    log.info("Error {}: {} {}", error.itemKey(), error.errorKey(), error.message());
                }
                exitStatus = BatchResult.STOP_FATAL.equals(result.stopReason()) ? 1 : 0;
            }
            default -> throw new IllegalArgumentException("Unknown aggregator.cli.mode: " + cli.getMode());
        }

        if (cli.isExitAfterRun()) {
            int status = exitStatus;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }
}
