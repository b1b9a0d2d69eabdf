package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.repository.RatingEventRepository;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy walk over the ledger in (recordedAt, id) order, one keyset page at a
 * time. The head event id is captured when the cursor is created, so every
 * iteration sees the same finite sequence even while appends continue.
 * Each call to {@link #iterator()} starts over from the beginning.
 */
public class LedgerCursor implements Iterable<RatingEvent> {

    @FunctionalInterface
    interface PageFetcher {
        List<RatingEvent> fetch(Instant afterTime, long afterId, int pageSize);
    }

    private final PageFetcher fetcher;
    private final Instant start;
    private final int pageSize;

    LedgerCursor(PageFetcher fetcher, Instant start, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive but was " + pageSize);
        }
        this.fetcher = fetcher;
        this.start = start;
        this.pageSize = pageSize;
    }

    /**
     * Events touching one entrant, from {@code since} (inclusive) or from the
     * start of the ledger when {@code since} is null.
     */
    public static LedgerCursor forEntrant(RatingEventRepository repository, Long entrantId,
                                          Instant since, int pageSize) {
        long headId = repository.findHeadEventId();
        return new LedgerCursor(
                (afterTime, afterId, size) -> repository.findPageForEntrant(
                        entrantId, headId, afterTime, afterId, PageRequest.of(0, size)),
                since, pageSize);
    }

    /** The whole ledger. */
    public static LedgerCursor all(RatingEventRepository repository, int pageSize) {
        long headId = repository.findHeadEventId();
        return new LedgerCursor(
                (afterTime, afterId, size) -> repository.findPage(
                        headId, afterTime, afterId, PageRequest.of(0, size)),
                null, pageSize);
    }

    @Override
    public Iterator<RatingEvent> iterator() {
        return new PageIterator();
    }

    private class PageIterator implements Iterator<RatingEvent> {

        private final Deque<RatingEvent> buffer = new ArrayDeque<>();
        // Before every stored event: recordedAt >= lower bound and ids start at 1
        private Instant afterTime = start != null ? start : Instant.EPOCH;
        private long afterId = 0;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                List<RatingEvent> page = fetcher.fetch(afterTime, afterId, pageSize);
                buffer.addAll(page);
                if (page.size() < pageSize) {
                    exhausted = true;
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public RatingEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RatingEvent event = buffer.poll();
            afterTime = event.getRecordedAt();
            afterId = event.getId();
            return event;
        }
    }
}
