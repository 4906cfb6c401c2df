package com.spa.aggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spa.aggregator.crawl.batch.EnrichmentCheckpointStore;
import com.spa.aggregator.crawl.batch.ResumableBatchDriver;
import com.spa.aggregator.crawl.service.CrawlRunRegistry;
import com.spa.aggregator.crawl.util.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AggregatorProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("catalog-crawl-run");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "autoEnrichExecutor", destroyMethod = "shutdownNow")
    public ExecutorService autoEnrichExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("auto-enrichment-loop");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public EnrichmentCheckpointStore enrichmentCheckpointStore(ObjectMapper objectMapper, AggregatorProperties properties) {
        return new EnrichmentCheckpointStore(objectMapper, Path.of(properties.getEnrichment().getCheckpointPath()));
    }

    @Bean
    public ResumableBatchDriver enrichmentBatchDriver(
        EnrichmentCheckpointStore checkpointStore,
        CrawlRunRegistry runRegistry,
        AggregatorProperties properties,
        Sleeper sleeper
    ) {
        AggregatorProperties.Enrichment enrichment = properties.getEnrichment();
        return new ResumableBatchDriver(
            "enrichment",
            checkpointStore,
            runRegistry,
            enrichment.getWorkers(),
            enrichment.getPerItemDelayMs(),
            enrichment.getErrorSampleSize(),
            sleeper
        );
    }
}
