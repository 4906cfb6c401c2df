package com.spa.aggregator.crawl.pager;

import com.spa.aggregator.crawl.http.RetryPolicy;
import com.spa.aggregator.crawl.model.CatalogFetchException;
import com.spa.aggregator.crawl.model.FetchErrorKind;
import com.spa.aggregator.crawl.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates every item of a catalog whose provider only serves the first {@code windowCeiling} results of a
 * query. A segment whose count reaches the ceiling is split into one child per alphabet symbol, recursively,
 * until every leaf segment fits in the window.
 * <p>
 * Items are emitted in a deterministic segment/page order. The traversal position counts items in that order,
 * including ones skipped on resume, so a crawl restarted with the last checkpointed position skips whole segments
 * by their probe counts and whole pages inside the segment it stopped in.
 * <p>
 * A segment whose probe or page keeps failing after retries is recorded and skipped; its siblings continue.
 * {@link FetchErrorKind#AUTH_INVALID} aborts the traversal by rethrowing.
 */
public class SegmentedPager<T> {
    private static final Logger log = LoggerFactory.getLogger(SegmentedPager.class);

    private final CatalogProvider<T> provider;
    private final PagerSettings settings;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public SegmentedPager(CatalogProvider<T> provider, PagerSettings settings, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.provider = provider;
        this.settings = settings;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.noRetry() : retryPolicy;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public SegmentCrawlResult crawl(CatalogFilters filters, long resumePosition, PagerHooks<T> hooks) {
        return new Traversal(Math.max(0, resumePosition), hooks).run(CatalogQuery.root(filters));
    }

    private final class Traversal {
        private final long resumePosition;
        private final PagerHooks<T> hooks;
        private final List<SegmentFailure> failedSegments = new ArrayList<>();
        private final List<String> truncatedSegments = new ArrayList<>();
        private long totalHits;
        private long position;
        private long emitted;
        private int segmentsVisited;
        private int itemFailures;
        private int requests;
        private boolean stopped;

        private Traversal(long resumePosition, PagerHooks<T> hooks) {
            this.resumePosition = resumePosition;
            this.hooks = hooks;
        }

        private SegmentCrawlResult run(CatalogQuery root) {
            if (!continuing()) {
                return result();
            }
            Long count = probe(root);
            if (count == null) {
                return result();
            }
            totalHits = count;
            hooks.onTotal(count);
            segmentsVisited++;
            if (count == 0) {
                return result();
            }
            if (count < settings.windowCeiling()) {
                pageSegment(root, count);
            } else {
                log.info("Catalog query has {} results (>= {}), subdividing", count, settings.windowCeiling());
                for (CatalogQuery child : rootSegments(root)) {
                    if (stopped) {
                        break;
                    }
                    fetchSegment(child, 1);
                }
            }
            if (!stopped) {
                hooks.onCheckpoint(position);
            }
            return result();
        }

        private List<CatalogQuery> rootSegments(CatalogQuery root) {
            List<CatalogQuery> segments = new ArrayList<>();
            if (!root.filters().symbols().isEmpty()) {
                root.filters().symbols().forEach(symbol -> segments.add(root.child(symbol)));
                return segments;
            }
            return children(root);
        }

        private List<CatalogQuery> children(CatalogQuery parent) {
            List<CatalogQuery> segments = new ArrayList<>();
            settings.alphabet().codePoints()
                .forEach(symbol -> segments.add(parent.child(new String(Character.toChars(symbol)))));
            return segments;
        }

        private void fetchSegment(CatalogQuery segment, int depth) {
            if (!continuing()) {
                return;
            }
            Long count = probe(segment);
            if (count == null) {
                return;
            }
            segmentsVisited++;
            if (count == 0) {
                return;
            }
            if (count < settings.windowCeiling()) {
                pageSegment(segment, count);
                return;
            }
            if (depth >= settings.maxDepth()) {
                log.warn(
                    "Segment '{}' still has {} results at depth {}; fetching only the first {}",
                    segment.label(),
                    count,
                    depth,
                    settings.windowCeiling()
                );
                truncatedSegments.add(segment.prefix());
                pageSegment(segment, count);
                return;
            }
            log.debug("Segment '{}' has {} results, subdividing", segment.label(), count);
            for (CatalogQuery child : children(segment)) {
                if (stopped) {
                    return;
                }
                fetchSegment(child, depth + 1);
            }
        }

        private void pageSegment(CatalogQuery segment, long count) {
            long window = Math.min(count, settings.windowCeiling());
            long segmentStart = position;
            long segmentEnd = segmentStart + window;
            if (segmentEnd <= resumePosition) {
                position = segmentEnd;
                return;
            }

            int pageSize = settings.pageSize();
            int offset = 0;
            long discard = 0;
            if (resumePosition > segmentStart) {
                long alreadyDone = resumePosition - segmentStart;
                offset = (int) ((alreadyDone / pageSize) * pageSize);
                discard = alreadyDone - offset;
                position = segmentStart + offset;
            }

            while (offset < window) {
                if (!continuing()) {
                    return;
                }
                int size = (int) Math.min(pageSize, settings.windowCeiling() - offset);
                CatalogPage<T> page = fetch(segment, offset, size);
                if (page == null) {
                    position = segmentEnd;
                    return;
                }
                List<T> items = page.items();
                for (T item : items) {
                    if (discard > 0) {
                        discard--;
                        position++;
                        continue;
                    }
                    emit(item);
                    position++;
                    if (settings.maxItems() > 0 && emitted >= settings.maxItems()) {
                        stopped = true;
                        hooks.onCheckpoint(position);
                        return;
                    }
                }
                offset += items.size();
                hooks.onCheckpoint(Math.min(position, segmentEnd));
                if (items.size() < size) {
                    break;
                }
            }
            position = segmentEnd;
        }

        private void emit(T item) {
            emitted++;
            try {
                hooks.onItem(item);
            } catch (RuntimeException e) {
                itemFailures++;
                log.warn("Item handler failed at position {}", position, e);
            }
        }

        private Long probe(CatalogQuery segment) {
            try {
                return retryPolicy.execute("probe '" + segment.label() + "'", () -> {
                    pace();
                    return provider.probeCount(segment);
                });
            } catch (CatalogFetchException e) {
                recordFailure(segment, e);
                return null;
            }
        }

        private CatalogPage<T> fetch(CatalogQuery segment, int offset, int size) {
            if (offset + size > settings.windowCeiling()) {
                throw new IllegalStateException("Page request past window: " + offset + "+" + size);
            }
            try {
                return retryPolicy.execute("page '" + segment.label() + "'@" + offset, () -> {
                    pace();
                    return provider.fetchPage(segment, offset, size);
                });
            } catch (CatalogFetchException e) {
                recordFailure(segment, e);
                return null;
            }
        }

        private void recordFailure(CatalogQuery segment, CatalogFetchException e) {
            if (e.kind().isFatalForRun()) {
                throw e;
            }
            if (Thread.currentThread().isInterrupted()) {
                stopped = true;
            }
            log.warn("Segment '{}' failed after retries: {}", segment.label(), e.getMessage());
            failedSegments.add(new SegmentFailure(segment.prefix(), e.kind(), e.getMessage()));
        }

        private void pace() {
            if (requests++ == 0 || settings.delayMs() == 0) {
                return;
            }
            try {
                sleeper.sleep(settings.delayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CatalogFetchException(FetchErrorKind.PERMANENT, 0, "pager interrupted", e);
            }
        }

        private boolean continuing() {
            if (stopped) {
                return false;
            }
            if (Thread.currentThread().isInterrupted() || !hooks.shouldContinue()) {
                stopped = true;
            }
            return !stopped;
        }

        private SegmentCrawlResult result() {
            return new SegmentCrawlResult(
                totalHits,
                emitted,
                position,
                segmentsVisited,
                itemFailures,
                failedSegments,
                truncatedSegments,
                stopped
            );
        }
    }
}
