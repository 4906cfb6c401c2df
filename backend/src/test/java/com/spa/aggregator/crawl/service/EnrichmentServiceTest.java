package com.spa.aggregator.crawl.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.batch.EnrichmentCheckpointStore;
import com.spa.aggregator.crawl.batch.ResumableBatchDriver;
import com.spa.aggregator.crawl.http.DetailSource;
import com.spa.aggregator.crawl.model.BatchResult;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.model.EnrichmentCandidate;
import com.spa.aggregator.crawl.model.EnrichmentFilterMode;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.model.SourceAttempt;
import com.spa.aggregator.crawl.persistence.ProductJdbcRepository;
import com.spa.aggregator.crawl.util.Sleeper;
import com.spa.aggregator.product.merge.MergeResult;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.ProductJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EnrichmentServiceTest {
    private static final String ISIN = "CH0000000001";
    private static final long CYCLE_RUN_ID = 5L;

    @TempDir
    Path tempDir;

    private final ProductJsonCodec codec = new ProductJsonCodec(new ObjectMapper());
    private final ProductJdbcRepository repository = mock(ProductJdbcRepository.class);
    private final CrawlRunRegistry registry = mock(CrawlRunRegistry.class);
    private AggregatorProperties properties;
    private ResumableBatchDriver driver;

    @BeforeEach
    void setUp() {
        properties = new AggregatorProperties();
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setTransientBackoffMs(0);
        properties.getEnrichment().setFilterMode("missing_coupon");
        EnrichmentCheckpointStore store = new EnrichmentCheckpointStore(
            new ObjectMapper().findAndRegisterModules(),
            tempDir.resolve("state.json")
        );
        driver = new ResumableBatchDriver("enrichment", store, registry, 2, 0, 10, Sleeper.NONE);
    }

    @Test
    void firstSourceWithDataIsMergedAndStored() {
        FakeSource empty = new FakeSource("first", isin -> NormalizedProduct.empty());
        FakeSource detail = new FakeSource("detail_html", isin -> withCoupon(7.5));
        FakeSource unused = new FakeSource("third", isin -> withCoupon(1.0));

        MergeResult result = service(empty, detail, unused).enrich(candidate());

        assertThat(result.changed()).isTrue();
        assertThat(result.merged().number(ProductAttribute.COUPON_RATE_PCT_PA).value()).isEqualTo(7.5);
        assertThat(unused.calls).isEmpty();
        ArgumentCaptor<NormalizedProduct> stored = ArgumentCaptor.forClass(NormalizedProduct.class);
        verify(repository).updateNormalized(eq("p-1"), stored.capture(), any(Instant.class));
        assertThat(stored.getValue().text(ProductAttribute.ISIN).value()).isEqualTo(ISIN);
    }

    @Test
    void noDataFromAnySourceReportsEveryAttempt() {
        FakeSource missing = new FakeSource("detail_html", isin -> {
            throw new CatalogFetchException(FetchErrorKind.NOT_FOUND, 404, "detail page " + isin + " failed", null);
        });
        FakeSource empty = new FakeSource("fallback", isin -> NormalizedProduct.empty());

        assertThatThrownBy(() -> service(missing, empty).enrich(candidate()))
            .isInstanceOfSatisfying(EnrichmentFailedException.class, e -> {
                assertThat(e.attempts()).extracting(SourceAttempt::source).containsExactly("detail_html", "fallback");
                assertThat(e.attempts().get(0).errorKey()).isEqualTo("fetch_http_404");
                assertThat(e.attempts().get(1).errorKey()).isEqualTo("no_data");
                assertThat(e.getMessage()).contains(ISIN);
            });
        verify(repository, never()).updateNormalized(any(), any(), any());
    }

    @Test
    void unchangedRecordIsNotWritten() {
        FakeSource same = new FakeSource("detail_html", isin -> NormalizedProduct.builder()
            .field(ProductAttribute.ISIN, isin, 0.6, "detail_html")
            .build());

        MergeResult result = service(same).enrich(candidate());

        assertThat(result.changed()).isFalse();
        verify(repository, never()).updateNormalized(any(), any(), any());
    }

    @Test
    void transientFailureIsRetriedBeforeMovingOn() {
        List<Boolean> failedOnce = new ArrayList<>();
        FakeSource flaky = new FakeSource("detail_html", isin -> {
            if (failedOnce.isEmpty()) {
                failedOnce.add(true);
                throw new CatalogFetchException(FetchErrorKind.TRANSIENT, 503, "HTTP 503", null);
            }
            return withCoupon(4.0);
        });

        MergeResult result = service(flaky).enrich(candidate());

        assertThat(flaky.calls).hasSize(2);
        assertThat(result.merged().number(ProductAttribute.COUPON_RATE_PCT_PA).value()).isEqualTo(4.0);
    }

    @Test
    void rejectedCredentialsPropagate() {
        FakeSource rejected = new FakeSource("detail_html", isin -> {
            throw new CatalogFetchException(FetchErrorKind.AUTH_INVALID, 403, "HTTP 403", null);
        });
        FakeSource fallback = new FakeSource("fallback", isin -> withCoupon(2.0));

        assertThatThrownBy(() -> service(rejected, fallback).enrich(candidate()))
            .isInstanceOf(CatalogFetchException.class);
        assertThat(fallback.calls).isEmpty();
    }

    @Test
    void cycleUsesConfiguredFilterAndCountsFailures() {
        EnrichmentCandidate other = new EnrichmentCandidate("p-2", "CH0000000002", codec.toJson(stored("CH0000000002")));
        when(repository.findEnrichmentCandidates(eq(EnrichmentFilterMode.MISSING_COUPON), anyInt(), anyInt()))
            .thenReturn(List.of(candidate(), other));
        FakeSource source = new FakeSource("detail_html", isin -> ISIN.equals(isin) ? withCoupon(6.0) : NormalizedProduct.empty());

        BatchResult result = service(source).runCycle(2, null);

        assertThat(result.succeeded()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.itemKey()).isEqualTo("CH0000000002");
            assertThat(error.errorKey()).isEqualTo(EnrichmentFailedException.ERROR_KEY);
        });
        assertThat(result.offsetAfter()).isEqualTo(2);
        verify(repository).findEnrichmentCandidates(EnrichmentFilterMode.MISSING_COUPON, 2, 0);
    }

    @Test
    void trackedCycleFailsItsRunWhenTheBatchThrows() {
        ResumableBatchDriver broken = mock(ResumableBatchDriver.class);
        when(broken.runCycle(anyInt(), any(), any(), any())).thenThrow(new UncheckedIOException("disk full", new IOException()));
        when(registry.create(CrawlRun.ENRICHMENT_CYCLE)).thenReturn(cycleRun());
        EnrichmentService service = serviceWith(broken);

        assertThatThrownBy(() -> service.runTrackedCycle(5)).isInstanceOf(UncheckedIOException.class);

        verify(registry).tryTransition(CYCLE_RUN_ID, CrawlRunStatus.FAILED, "cycle_failed: disk full");
    }

    @Test
    void trackedCycleStoppedByPauseIsCancelled() {
        ResumableBatchDriver paused = mock(ResumableBatchDriver.class);
        when(paused.runCycle(anyInt(), any(), any(), any()))
            .thenReturn(new BatchResult(3, 1, 1, 0, 0, 1, List.of(), BatchResult.STOP_PAUSED));
        when(registry.create(CrawlRun.ENRICHMENT_CYCLE)).thenReturn(cycleRun());
        when(registry.status(CYCLE_RUN_ID)).thenReturn(CrawlRunStatus.PAUSED);

        serviceWith(paused).runTrackedCycle(3);

        verify(registry).tryTransition(CYCLE_RUN_ID, CrawlRunStatus.CANCELLED, "paused_cycle_ended");
        verify(registry, never()).tryTransition(CYCLE_RUN_ID, CrawlRunStatus.COMPLETED, null);
    }

    @Test
    void trackedCycleCompletesItsRun() {
        ResumableBatchDriver done = mock(ResumableBatchDriver.class);
        when(done.runCycle(anyInt(), any(), any(), any()))
            .thenReturn(new BatchResult(0, 0, 0, 0, 4, 0, List.of(), BatchResult.STOP_EXHAUSTED));
        when(registry.create(CrawlRun.ENRICHMENT_CYCLE)).thenReturn(cycleRun());
        when(registry.status(CYCLE_RUN_ID)).thenReturn(CrawlRunStatus.RUNNING);

        serviceWith(done).runTrackedCycle(null);

        verify(registry).tryTransition(CYCLE_RUN_ID, CrawlRunStatus.COMPLETED, null);
    }

    @Test
    void busyCycleLockRejectsTrackedCycleWithoutCreatingRun() {
        ResumableBatchDriver slow = mock(ResumableBatchDriver.class);
        List<Throwable> rejected = new ArrayList<>();
        EnrichmentService service = serviceWith(slow);
        when(slow.runCycle(anyInt(), any(), any(), any())).thenAnswer(invocation -> {
            Throwable failure = CompletableFuture.runAsync(() -> service.runTrackedCycle(1))
                .handle((ignored, error) -> error)
                .join();
            rejected.add(failure);
            return new BatchResult(0, 0, 0, 0, 0, 0, List.of(), BatchResult.STOP_EXHAUSTED);
        });

        service.runCycle(1, null);

        assertThat(rejected).singleElement().satisfies(error ->
            assertThat(error).hasCauseInstanceOf(ActiveCrawlRunException.class));
        verify(registry, never()).create(CrawlRun.ENRICHMENT_CYCLE);
    }

    private EnrichmentService serviceWith(ResumableBatchDriver batchDriver) {
        return new EnrichmentService(repository, codec, List.of(), batchDriver, registry, properties, Sleeper.NONE);
    }

    private static CrawlRun cycleRun() {
        return new CrawlRun(
            CYCLE_RUN_ID, CrawlRun.ENRICHMENT_CYCLE, CrawlRunStatus.RUNNING, null, 0, 0, null, 0, null,
            Instant.now(), Instant.now(), null
        );
    }

    private EnrichmentService service(DetailSource... sources) {
        return new EnrichmentService(repository, codec, List.of(sources), driver, registry, properties, Sleeper.NONE);
    }

    private EnrichmentCandidate candidate() {
        return new EnrichmentCandidate("p-1", ISIN, codec.toJson(stored(ISIN)));
    }

    private static NormalizedProduct stored(String isin) {
        return NormalizedProduct.builder()
            .field(ProductAttribute.ISIN, isin, 0.9, "catalog_api")
            .field(ProductAttribute.CURRENCY, "CHF", 0.9, "catalog_api")
            .build();
    }

    private static NormalizedProduct withCoupon(double coupon) {
        return NormalizedProduct.builder()
            .field(ProductAttribute.ISIN, ISIN, 0.7, "detail_html")
            .field(ProductAttribute.COUPON_RATE_PCT_PA, coupon, 0.8, "detail_html")
            .build();
    }

    private static final class FakeSource implements DetailSource {
        private final String name;
        private final Function<String, NormalizedProduct> behaviour;
        private final List<String> calls = new ArrayList<>();

        private FakeSource(String name, Function<String, NormalizedProduct> behaviour) {
            this.name = name;
            this.behaviour = behaviour;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public NormalizedProduct fetch(String isin) {
            synchronized (calls) {
                calls.add(isin);
            }
            return behaviour.apply(isin);
        }
    }
}
