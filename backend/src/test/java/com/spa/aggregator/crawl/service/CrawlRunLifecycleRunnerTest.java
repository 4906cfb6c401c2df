package com.spa.aggregator.crawl.service;

import com.spa.aggregator.config.AggregatorProperties;
import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.persistence.CrawlRunJdbcRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlRunLifecycleRunnerTest {

    @Mock
    private CrawlRunJdbcRepository repository;

    @Mock
    private CrawlRunRegistry registry;

    @Test
    void pausesStaleCatalogCrawlAndFailsOtherStaleRuns() {
        Instant stale = Instant.now().minus(Duration.ofHours(2));
        Instant fresh = Instant.now();
        when(repository.isDbReachable()).thenReturn(true);
        when(registry.running()).thenReturn(List.of(
            run(1L, CrawlRun.CATALOG_API, stale),
            run(2L, CrawlRun.AUTO_ENRICHMENT, stale),
            run(3L, CrawlRun.ENRICHMENT_CYCLE, fresh)
        ));
        when(registry.tryTransition(anyLong(), any(), any())).thenReturn(true);

        runner().run(new DefaultApplicationArguments());

        verify(registry).tryTransition(1L, CrawlRunStatus.PAUSED, CrawlRunLifecycleRunner.INTERRUPTED_BY_RESTART);
        verify(registry).tryTransition(2L, CrawlRunStatus.FAILED, CrawlRunLifecycleRunner.INTERRUPTED_BY_RESTART);
        verify(registry, never()).tryTransition(eq(3L), any(), any());
    }

    @Test
    void skipsCleanupWhenDatabaseIsUnreachable() {
        when(repository.isDbReachable()).thenThrow(new IllegalStateException("connection refused"));

        runner().run(new DefaultApplicationArguments());

        verify(registry, never()).running();
    }

    private CrawlRunLifecycleRunner runner() {
        AggregatorProperties properties = new AggregatorProperties();
        properties.getRuns().setStaleRunMinutes(30);
        return new CrawlRunLifecycleRunner(repository, registry, properties);
    }

    private static CrawlRun run(long id, String name, Instant updatedAt) {
        return new CrawlRun(id, name, CrawlRunStatus.RUNNING, null, 0, 0, null, 4, null, updatedAt, updatedAt, null);
    }
}
