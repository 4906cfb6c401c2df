package com.spa.aggregator.crawl.persistence;

import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlRunJdbcRepositoryTest {

    @Autowired
    private CrawlRunJdbcRepository repository;

    @Test
    void countersAndCheckpointAccumulate() {
        long runId = repository.insertRun(CrawlRun.CATALOG_API, "{\"maxItems\":0}", Instant.now());

        repository.setTotal(runId, 120, Instant.now());
        repository.incrementCompleted(runId, 1, Instant.now());
        repository.incrementCompleted(runId, 1, Instant.now());
        repository.incrementErrors(runId, "CH0000000001: no_source_data", Instant.now());
        repository.updateCheckpoint(runId, 50, Instant.now());

        CrawlRun run = repository.findById(runId);
        assertEquals(CrawlRunStatus.RUNNING, run.status());
        assertEquals(120L, run.total());
        assertEquals(2, run.completed());
        assertEquals(1, run.errorsCount());
        assertEquals("CH0000000001: no_source_data", run.lastError());
        assertEquals(50, run.checkpointOffset());
        assertEquals("{\"maxItems\":0}", run.paramsJson());
        assertNull(run.endedAt());
    }

    @Test
    void transitionIsCompareAndSet() {
        long runId = repository.insertRun(CrawlRun.AUTO_ENRICHMENT, null, Instant.now());

        assertFalse(repository.transition(runId, CrawlRunStatus.PAUSED, CrawlRunStatus.RUNNING, null, Instant.now()));
        assertTrue(repository.transition(runId, CrawlRunStatus.RUNNING, CrawlRunStatus.PAUSED, null, Instant.now()));
        assertEquals(CrawlRunStatus.PAUSED, repository.findStatus(runId));
        assertNull(repository.findById(runId).endedAt());
    }

    @Test
    void endedAtIsStampedOnceOnTerminalStatus() {
        long runId = repository.insertRun(CrawlRun.CATALOG_API, null, Instant.now());
        Instant failedAt = Instant.parse("2026-01-02T03:04:05Z");

        assertTrue(repository.transition(runId, CrawlRunStatus.RUNNING, CrawlRunStatus.FAILED, "auth_invalid: 401", failedAt));
        CrawlRun failed = repository.findById(runId);

        assertEquals(CrawlRunStatus.FAILED, failed.status());
        assertEquals("auth_invalid: 401", failed.lastError());
        assertNotNull(failed.endedAt());
        assertEquals(failedAt, failed.endedAt());
    }

    @Test
    void activeRunsAreFoundByName() {
        long running = repository.insertRun("active_lookup_test", null, Instant.now());
        long done = repository.insertRun("active_lookup_test", null, Instant.now());
        repository.transition(done, CrawlRunStatus.RUNNING, CrawlRunStatus.COMPLETED, null, Instant.now());

        assertEquals(1, repository.findActiveByName("active_lookup_test").size());
        assertEquals(running, repository.findActiveByName("active_lookup_test").get(0).id());
        assertNull(repository.findById(-1));
        assertNull(repository.findStatus(-1));
    }
}
