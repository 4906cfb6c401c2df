package com.spa.aggregator.crawl.service;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.batch.BatchItemHandler;
import com.spa.aggregator.crawl.batch.ResumableBatchDriver;
import com.spa.aggregator.crawl.http.DetailSource;
import com.spa.aggregator.crawl.http.RetryPolicy;
import com.spa.aggregator.crawl.model.BatchResult;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.model.EnrichmentCandidate;
import com.spa.aggregator.crawl.model.EnrichmentCheckpoint;
import com.spa.aggregator.crawl.model.EnrichmentFilterMode;
import com.spa.aggregator.crawl.model.SourceAttempt;
import com.spa.aggregator.crawl.persistence.ProductJdbcRepository;
import com.spa.aggregator.crawl.util.Sleeper;
import com.spa.aggregator.product.merge.MergeResult;
import com.spa.aggregator.product.merge.ProductMerger;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.ProductJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fills gaps in stored products from per-ISIN detail sources. Sources are tried in their declared order and the
 * first one that yields data is merged into the stored record.
 */
@Service
public class EnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);
    static final String CYCLE_FAILED = "cycle_failed";
    static final String PAUSED_CYCLE_ENDED = "paused_cycle_ended";

    private final ProductJdbcRepository productRepository;
    private final ProductJsonCodec codec;
    private final List<DetailSource> detailSources;
    private final ResumableBatchDriver batchDriver;
    private final CrawlRunRegistry runRegistry;
    private final AggregatorProperties properties;
    private final Sleeper sleeper;
    private final ReentrantLock cycleLock = new ReentrantLock();

    public EnrichmentService(
        ProductJdbcRepository productRepository,
        ProductJsonCodec codec,
        List<DetailSource> detailSources,
        ResumableBatchDriver batchDriver,
        CrawlRunRegistry runRegistry,
        AggregatorProperties properties,
        Sleeper sleeper
    ) {
        this.productRepository = productRepository;
        this.codec = codec;
        this.detailSources = List.copyOf(detailSources);
        this.batchDriver = batchDriver;
        this.runRegistry = runRegistry;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Runs one batch as its own {@code enrichment_cycle} run. The run always ends in a terminal status: a cycle
     * stopped by a pause is cancelled, since no loop picks it up again, and a cycle that throws fails the run.
     *
     * @throws ActiveCrawlRunException when another batch is in progress; no run is created then
     */
    public BatchResult runTrackedCycle(Integer batchSize) {
        acquireCycleLock();
        try {
            CrawlRun run = runRegistry.create(CrawlRun.ENRICHMENT_CYCLE);
            BatchResult result;
            try {
                result = runLocked(batchSize, run.id());
            } catch (RuntimeException e) {
                log.warn("Enrichment cycle run {} failed", run.id(), e);
                runRegistry.tryTransition(run.id(), CrawlRunStatus.FAILED, CYCLE_FAILED + ": " + e.getMessage());
                throw e;
            }
            CrawlRunStatus status = runRegistry.status(run.id());
            if (status == CrawlRunStatus.RUNNING) {
                runRegistry.tryTransition(run.id(), CrawlRunStatus.COMPLETED, null);
            } else if (status == CrawlRunStatus.PAUSED) {
                runRegistry.tryTransition(run.id(), CrawlRunStatus.CANCELLED, PAUSED_CYCLE_ENDED);
            }
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Runs one batch. Only one batch runs at a time because batches share the checkpoint.
     *
     * @throws ActiveCrawlRunException when another batch is in progress
     */
    public BatchResult runCycle(Integer batchSize, Long runId) {
        acquireCycleLock();
        try {
            return runLocked(batchSize, runId);
        } finally {
            cycleLock.unlock();
        }
    }

    private void acquireCycleLock() {
        if (!cycleLock.tryLock()) {
            throw new ActiveCrawlRunException("An enrichment batch is already in progress");
        }
    }

    private BatchResult runLocked(Integer batchSize, Long runId) {
        int size = batchSize == null ? properties.getEnrichment().getDefaultBatchSize() : Math.max(1, batchSize);
        EnrichmentFilterMode mode = EnrichmentFilterMode.parse(properties.getEnrichment().getFilterMode());
        return batchDriver.runCycle(
            size,
            (limit, offset) -> productRepository.findEnrichmentCandidates(mode, limit, (int) offset),
            new CandidateHandler(),
            runId
        );
    }

    public EnrichmentCheckpoint checkpoint() {
        return batchDriver.checkpoint();
    }

    public EnrichmentCheckpoint resetCheckpoint() {
        return batchDriver.reset();
    }

    /**
     * Enriches one stored product.
     *
     * @throws EnrichmentFailedException when no source yields data
     * @throws CatalogFetchException     when a source reports a run-level failure such as rejected credentials
     */
    public MergeResult enrich(EnrichmentCandidate candidate) {
        NormalizedProduct stored = codec.fromJson(candidate.normalizedJson()).toBuilder().id(candidate.id()).build();
        RetryPolicy retryPolicy = RetryPolicy.from(properties.getRetry(), sleeper);
        List<SourceAttempt> attempts = new ArrayList<>();
        NormalizedProduct found = null;
        for (DetailSource source : detailSources) {
            try {
                NormalizedProduct fetched = retryPolicy.execute(
                    source.name() + " " + candidate.isin(),
                    () -> source.fetch(candidate.isin())
                );
                if (fetched == null || fetched.isEmpty()) {
                    attempts.add(SourceAttempt.empty(source.name()));
                    continue;
                }
                attempts.add(SourceAttempt.success(source.name()));
                found = fetched;
                break;
            } catch (CatalogFetchException e) {
                if (e.kind().isFatalForRun()) {
                    throw e;
                }
                attempts.add(SourceAttempt.failure(source.name(), e.errorKey(), e.getMessage()));
            }
        }
        if (found == null) {
            throw new EnrichmentFailedException(candidate.isin(), attempts);
        }

        MergeResult result = ProductMerger.merge(stored, found, preferSecondary());
        if (result.changed()) {
            productRepository.updateNormalized(candidate.id(), result.merged(), Instant.now());
            log.debug(
                "Enriched {} ({}) with {} override(s)",
                candidate.isin(),
                candidate.id(),
                result.newEntries().size()
            );
        }
        return result;
    }

    private Set<ProductAttribute> preferSecondary() {
        return ProductMerger.attributesFromKeys(properties.getEnrichment().getPreferSecondaryFields());
    }

    private final class CandidateHandler implements BatchItemHandler<EnrichmentCandidate> {

        @Override
        public String key(EnrichmentCandidate item) {
            return item.isin();
        }

        @Override
        public void process(EnrichmentCandidate item) {
            enrich(item);
        }

        @Override
        public String errorKey(RuntimeException failure) {
            if (failure instanceof EnrichmentFailedException) {
                return EnrichmentFailedException.ERROR_KEY;
            }
            return BatchItemHandler.super.errorKey(failure);
        }
    }
}
