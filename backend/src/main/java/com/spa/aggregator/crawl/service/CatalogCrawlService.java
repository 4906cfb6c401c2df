package com.spa.aggregator.crawl.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.http.RetryPolicy;
import com.spa.aggregator.crawl.model.CatalogCrawlRequest;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.pager.CatalogFilters;
import com.spa.aggregator.crawl.pager.CatalogProvider;
import com.spa.aggregator.crawl.pager.PagerHooks;
import com.spa.aggregator.crawl.pager.PagerSettings;
import com.spa.aggregator.crawl.pager.SegmentCrawlResult;
import com.spa.aggregator.crawl.pager.SegmentFailure;
import com.spa.aggregator.crawl.pager.SegmentedPager;
import com.spa.aggregator.crawl.persistence.ProductJdbcRepository;
import com.spa.aggregator.crawl.util.HashUtils;
import com.spa.aggregator.crawl.util.Sleeper;
import com.spa.aggregator.product.merge.ProductMerger;
import com.spa.aggregator.product.model.Field;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.parse.CatalogJsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Full catalog crawls. A run walks the catalog with {@link SegmentedPager}, upserts every listed product keyed by
 * its ISIN and stores the traversal position as the run's checkpoint, so a paused run resumes where it stopped.
 */
@Service
public class CatalogCrawlService {
    private static final Logger log = LoggerFactory.getLogger(CatalogCrawlService.class);

    private final CrawlRunRegistry runRegistry;
    private final CatalogProvider<JsonNode> catalogProvider;
    private final CatalogJsonParser parser;
    private final ProductJdbcRepository productRepository;
    private final AggregatorProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService crawlRunExecutor;
    private final Sleeper sleeper;

    public CatalogCrawlService(
        CrawlRunRegistry runRegistry,
        CatalogProvider<JsonNode> catalogProvider,
        CatalogJsonParser parser,
        ProductJdbcRepository productRepository,
        AggregatorProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        Sleeper sleeper
    ) {
        this.runRegistry = runRegistry;
        this.catalogProvider = catalogProvider;
        this.parser = parser;
        this.productRepository = productRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.crawlRunExecutor = crawlRunExecutor;
        this.sleeper = sleeper;
    }

    public CrawlRun start(CatalogCrawlRequest request) {
        CatalogCrawlRequest effective = request == null ? CatalogCrawlRequest.unrestricted() : request;
        ensureNoActiveRun(null);
        CrawlRun run = runRegistry.create(CrawlRun.CATALOG_API, writeParams(effective));
        crawlRunExecutor.submit(() -> execute(run.id(), effective, 0));
        return run;
    }

    /**
     * Runs a crawl on the calling thread; used by the command line runner.
     */
    public CrawlRun runBlocking(CatalogCrawlRequest request) {
        CatalogCrawlRequest effective = request == null ? CatalogCrawlRequest.unrestricted() : request;
        ensureNoActiveRun(null);
        CrawlRun run = runRegistry.create(CrawlRun.CATALOG_API, writeParams(effective));
        execute(run.id(), effective, 0);
        return runRegistry.get(run.id());
    }

    public CrawlRun resume(long runId) {
        CrawlRun run = requireCatalogRun(runId);
        ensureNoActiveRun(runId);
        CrawlRun resumed = runRegistry.resume(run.id());
        CatalogCrawlRequest request = readParams(run.paramsJson());
        long position = resumed.checkpointOffset();
        log.info("Resuming catalog crawl {} from position {}", runId, position);
        crawlRunExecutor.submit(() -> execute(runId, request, position));
        return resumed;
    }

    public CrawlRun pause(long runId) {
        return runRegistry.pause(requireCatalogRun(runId).id());
    }

    public CrawlRun cancel(long runId) {
        return runRegistry.cancel(requireCatalogRun(runId).id());
    }

    void execute(long runId, CatalogCrawlRequest request, long resumePosition) {
        AggregatorProperties.Catalog catalog = properties.getCatalog();
        if (!catalog.isEnabled()) {
            runRegistry.tryTransition(runId, CrawlRunStatus.FAILED, "catalog_disabled: catalog crawling is disabled");
            return;
        }
        if (!catalog.hasApiToken()) {
            runRegistry.tryTransition(runId, CrawlRunStatus.FAILED, "auth_invalid: catalog_api_token not configured");
            return;
        }
        try {
            SegmentedPager<JsonNode> pager = new SegmentedPager<>(
                catalogProvider,
                PagerSettings.from(catalog, request.maxItemsOrZero()),
                RetryPolicy.from(properties.getRetry(), sleeper),
                sleeper
            );
            CatalogFilters filters = new CatalogFilters(request.productTypes(), request.symbols(), request.currencies());
            SegmentCrawlResult result = pager.crawl(filters, resumePosition, new RunHooks(runId));
            finish(runId, result);
        } catch (CatalogFetchException e) {
            log.error("Catalog crawl {} aborted: {}", runId, e.getMessage(), e);
            runRegistry.tryTransition(runId, CrawlRunStatus.FAILED, e.errorKey() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Catalog crawl {} failed", runId, e);
            runRegistry.tryTransition(runId, CrawlRunStatus.FAILED, "crawl_failed: " + e.getMessage());
        }
    }

    private void finish(long runId, SegmentCrawlResult result) {
        log.info(
            "Catalog crawl {} traversal ended: total={} emitted={} position={} segments={} itemFailures={} "
                + "failedSegments={} truncatedSegments={} stoppedEarly={}",
            runId,
            result.totalHits(),
            result.emitted(),
            result.position(),
            result.segmentsVisited(),
            result.itemFailures(),
            result.failedSegments().size(),
            result.truncatedSegments().size(),
            result.stoppedEarly()
        );
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Catalog crawl {} interrupted; leaving it for restart recovery", runId);
            return;
        }
        if (runRegistry.status(runId) != CrawlRunStatus.RUNNING) {
            return;
        }
        runRegistry.updateCheckpoint(runId, result.position());
        if (!result.failedSegments().isEmpty()) {
            String failed = result.failedSegments().stream()
                .map(SegmentFailure::segment)
                .map(segment -> segment.isEmpty() ? "<root>" : segment)
                .collect(Collectors.joining(","));
            runRegistry.recordError(runId, "segments_failed: " + failed);
        }
        runRegistry.tryTransition(runId, CrawlRunStatus.COMPLETED, null);
    }

    private CrawlRun requireCatalogRun(long runId) {
        CrawlRun run = runRegistry.get(runId);
        if (!CrawlRun.CATALOG_API.equals(run.name())) {
            throw new IllegalArgumentException("Crawl run " + runId + " is not a catalog crawl");
        }
        return run;
    }

    private void ensureNoActiveRun(Long allowedRunId) {
        for (CrawlRun run : runRegistry.active(CrawlRun.CATALOG_API)) {
            if (allowedRunId != null && run.id() == allowedRunId) {
                continue;
            }
            String message = "Active catalog crawl in progress (id=" + run.id()
                + ", status=" + run.status().dbValue()
                + ", startedAt=" + run.startedAt() + ")";
            throw new ActiveCrawlRunException(message);
        }
    }

    private String writeParams(CatalogCrawlRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize crawl parameters", e);
        }
    }

    private CatalogCrawlRequest readParams(String paramsJson) {
        if (paramsJson == null || paramsJson.isBlank()) {
            return CatalogCrawlRequest.unrestricted();
        }
        try {
            return objectMapper.readValue(paramsJson, CatalogCrawlRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored crawl parameters are unreadable", e);
        }
    }

    private final class RunHooks implements PagerHooks<JsonNode> {
        private final long runId;

        private RunHooks(long runId) {
            this.runId = runId;
        }

        @Override
        public void onTotal(long totalHits) {
            runRegistry.setTotal(runId, totalHits);
        }

        @Override
        public void onItem(JsonNode item) {
            try {
                store(item);
                runRegistry.incrementCompleted(runId);
            } catch (RuntimeException e) {
                runRegistry.recordError(runId, "item_failed: " + e.getMessage());
                throw e;
            }
        }

        @Override
        public void onCheckpoint(long position) {
            runRegistry.updateCheckpoint(runId, position);
        }

        @Override
        public boolean shouldContinue() {
            return runRegistry.isRunning(runId);
        }

        private void store(JsonNode item) {
            NormalizedProduct product = parser.parse(item, CatalogJsonParser.SOURCE);
            Field<String> isin = product.text(ProductAttribute.ISIN);
            if (!isin.isPresent()) {
                throw new IllegalArgumentException("catalog product without ISIN");
            }
            String contentHash = HashUtils.contentHash(CatalogJsonParser.SOURCE, isin.value());
            productRepository.upsert(
                contentHash,
                CatalogJsonParser.SOURCE,
                mergeWithStored(contentHash, product),
                item.toString(),
                null,
                Instant.now()
            );
        }
    }

    /**
     * Folds a fresh catalog record into the stored one. Attributes the catalog lists are refreshed, except those
     * enrichment is configured to prefer from detail sources; everything else keeps its stored value.
     */
    NormalizedProduct mergeWithStored(String contentHash, NormalizedProduct parsed) {
        String existingId = productRepository.findIdByHash(contentHash);
        NormalizedProduct stored = existingId == null ? null : productRepository.findProduct(existingId);
        if (stored == null) {
            return parsed;
        }
        Set<ProductAttribute> refreshed = EnumSet.noneOf(ProductAttribute.class);
        refreshed.addAll(parsed.presentFields().keySet());
        refreshed.removeAll(ProductMerger.attributesFromKeys(properties.getEnrichment().getPreferSecondaryFields()));
        return ProductMerger.merge(stored, parsed, refreshed).merged();
    }
}
