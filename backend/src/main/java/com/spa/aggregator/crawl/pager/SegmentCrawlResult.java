package com.spa.aggregator.crawl.pager;

import java.util.List;

/**
 * @param position           traversal position reached; pass it back as the resume position to continue
 * @param truncatedSegments  segments still over the window at the depth cap; only their first window was fetched
 * @param stoppedEarly       the traversal ended because hooks asked to stop or the item limit was reached
 */
public record SegmentCrawlResult(
    long totalHits,
    long emitted,
    long position,
    int segmentsVisited,
    int itemFailures,
    List<SegmentFailure> failedSegments,
    List<String> truncatedSegments,
    boolean stoppedEarly
) {
    public SegmentCrawlResult {
        failedSegments = List.copyOf(failedSegments);
        truncatedSegments = List.copyOf(truncatedSegments);
    }

    public boolean isComplete() {
        return !stoppedEarly && failedSegments.isEmpty() && truncatedSegments.isEmpty();
    }
}
