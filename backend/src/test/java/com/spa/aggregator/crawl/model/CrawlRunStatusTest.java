package com.spa.aggregator.crawl.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlRunStatusTest {

    @Test
    void runningMayMoveAnywhere() {
        assertThat(CrawlRunStatus.RUNNING.allowedTargets()).containsExactlyInAnyOrder(
            CrawlRunStatus.COMPLETED,
            CrawlRunStatus.FAILED,
            CrawlRunStatus.PAUSED,
            CrawlRunStatus.CANCELLED
        );
    }

    @Test
    void pausedOnlyResumesOrCancels() {
        assertThat(CrawlRunStatus.PAUSED.canTransitionTo(CrawlRunStatus.RUNNING)).isTrue();
        assertThat(CrawlRunStatus.PAUSED.canTransitionTo(CrawlRunStatus.CANCELLED)).isTrue();
        assertThat(CrawlRunStatus.PAUSED.canTransitionTo(CrawlRunStatus.COMPLETED)).isFalse();
    }

    @Test
    void terminalStatesAreFinal() {
        for (CrawlRunStatus terminal : new CrawlRunStatus[] {
            CrawlRunStatus.COMPLETED, CrawlRunStatus.FAILED, CrawlRunStatus.CANCELLED
        }) {
            assertThat(terminal.isTerminal()).isTrue();
            assertThat(terminal.allowedTargets()).isEmpty();
        }
        assertThat(CrawlRunStatus.RUNNING.canTransitionTo(CrawlRunStatus.RUNNING)).isFalse();
    }

    @Test
    void readsDatabaseValues() {
        assertThat(CrawlRunStatus.fromDb("paused")).isEqualTo(CrawlRunStatus.PAUSED);
        assertThat(CrawlRunStatus.CANCELLED.dbValue()).isEqualTo("cancelled");
        assertThatThrownBy(() -> CrawlRunStatus.fromDb(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
