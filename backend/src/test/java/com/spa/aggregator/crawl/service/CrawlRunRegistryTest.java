package com.spa.aggregator.crawl.service;

import com.spa.aggregator.crawl.model.CrawlRun;
import com.spa.aggregator.crawl.model.CrawlRunStatus;
import com.spa.aggregator.crawl.persistence.CrawlRunJdbcRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlRunRegistryTest {

    @Mock
    private CrawlRunJdbcRepository repository;

    @InjectMocks
    private CrawlRunRegistry registry;

    @Test
    void pauseMovesRunningRun() {
        when(repository.findStatus(7L)).thenReturn(CrawlRunStatus.RUNNING);
        when(repository.transition(eq(7L), eq(CrawlRunStatus.RUNNING), eq(CrawlRunStatus.PAUSED), eq(null), any(Instant.class)))
            .thenReturn(true);
        when(repository.findById(7L)).thenReturn(run(7L, CrawlRunStatus.PAUSED));

        CrawlRun paused = registry.pause(7L);

        assertThat(paused.status()).isEqualTo(CrawlRunStatus.PAUSED);
    }

    @Test
    void rejectsTransitionOutOfTerminalState() {
        when(repository.findStatus(7L)).thenReturn(CrawlRunStatus.COMPLETED);

        assertThatThrownBy(() -> registry.resume(7L))
            .isInstanceOfSatisfying(IllegalRunTransitionException.class, e -> {
                assertThat(e.from()).isEqualTo(CrawlRunStatus.COMPLETED);
                assertThat(e.to()).isEqualTo(CrawlRunStatus.RUNNING);
            });
        verify(repository, never()).transition(anyLong(), any(), any(), any(), any());
    }

    @Test
    void rereadsStatusWhenConcurrentWriterWins() {
        when(repository.findStatus(7L)).thenReturn(CrawlRunStatus.RUNNING, CrawlRunStatus.CANCELLED);
        when(repository.transition(eq(7L), eq(CrawlRunStatus.RUNNING), eq(CrawlRunStatus.COMPLETED), eq(null), any(Instant.class)))
            .thenReturn(false);

        assertThatThrownBy(() -> registry.complete(7L))
            .isInstanceOfSatisfying(
                IllegalRunTransitionException.class,
                e -> assertThat(e.from()).isEqualTo(CrawlRunStatus.CANCELLED)
            );
    }

    @Test
    void tryTransitionReportsRefusalWithoutThrowing() {
        when(repository.findStatus(7L)).thenReturn(CrawlRunStatus.CANCELLED);

        assertThat(registry.tryTransition(7L, CrawlRunStatus.COMPLETED, null)).isFalse();
    }

    @Test
    void unknownRunIsNotFound() {
        when(repository.findStatus(99L)).thenReturn(null);

        assertThatThrownBy(() -> registry.cancel(99L)).isInstanceOf(CrawlRunNotFoundException.class);
        assertThatThrownBy(() -> registry.get(99L)).isInstanceOf(CrawlRunNotFoundException.class);
    }

    @Test
    void recentIsCapped() {
        registry.recent(5000);
        verify(repository).findRecent(200);
    }

    private static CrawlRun run(long id, CrawlRunStatus status) {
        Instant now = Instant.now();
        return new CrawlRun(id, CrawlRun.CATALOG_API, status, null, 0, 0, null, 0, null, now, now, null);
    }
}
