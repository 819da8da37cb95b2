package com.koni.eventcache.infrastructure.cache;

import com.koni.eventcache.domain.model.Event;
import com.koni.eventcache.domain.repository.EventStore;
import com.koni.eventcache.domain.repository.OutOfOrderPolicy;
import com.koni.eventcache.infrastructure.observability.EventCacheMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of the EventStore that retains events inside a sliding
 * time window.
 *
 * Events are kept in arrival order (or creation-time order with
 * {@link OutOfOrderPolicy#SORTED_INSERT}). Every insertion prunes the longest prefix
 * of events older than {@code now - window}, scanning from the head and stopping at
 * the first event still inside the window. A window of zero disables pruning.
 *
 * Insert and prune run under the write lock. Queries copy the sequence under the
 * read lock and filter the copy after releasing it, so a reader never sees a
 * half-applied insertion and never holds the lock while filtering.
 *
 * Queries are a linear scan over the retained events; there is no per-device index.
 */
@Slf4j
public class WindowedEventStore implements EventStore {

    private final List<Event> events = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final long windowSeconds;
    private final OutOfOrderPolicy outOfOrderPolicy;
    private final Clock clock;
    private final EventCacheMetrics metrics;

    /**
     * Creates a new WindowedEventStore.
     *
     * @param window the retention window, {@link Duration#ZERO} to retain everything
     * @param outOfOrderPolicy how to handle events older than the current tail
     * @param clock the time source used to compute the pruning cutoff
     * @param metrics metrics sink for pruned, dropped and out-of-order events
     * @throws IllegalArgumentException if window is negative or has a fractional second part
     */
    public WindowedEventStore(Duration window,
                              OutOfOrderPolicy outOfOrderPolicy,
                              Clock clock,
                              EventCacheMetrics metrics) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window must be zero or positive");
        }
        if (window.getNano() != 0) {
            throw new IllegalArgumentException("window must be a whole number of seconds, got " + window);
        }
        this.windowSeconds = window.getSeconds();
        this.outOfOrderPolicy = outOfOrderPolicy == null ? OutOfOrderPolicy.RETAIN : outOfOrderPolicy;
        this.clock = clock;
        this.metrics = metrics;

        if (windowSeconds == 0) {
            log.warn("Event retention is disabled (window=0); the store grows without bound");
        } else {
            log.info("Windowed event store created: window={}s, outOfOrderPolicy={}",
                    windowSeconds, this.outOfOrderPolicy);
        }
    }

    @Override
    public int insert(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        lock.writeLock().lock();
        try {
            Event tail = events.isEmpty() ? null : events.get(events.size() - 1);

            if (tail != null && event.isOlderThan(tail)) {
                metrics.recordOutOfOrder();
                if (outOfOrderPolicy == OutOfOrderPolicy.DROP) {
                    log.warn("Out-of-order event dropped: deviceId={}, creationTime={}, latestCreationTime={}",
                            event.getDeviceId(), event.getCreationTime(), tail.getCreationTime());
                    metrics.recordDropped();
                } else if (outOfOrderPolicy == OutOfOrderPolicy.SORTED_INSERT) {
                    events.add(upperBound(event.getCreationTime()), event);
                } else {
                    log.warn("Out-of-order event retained at tail: deviceId={}, creationTime={}, latestCreationTime={}",
                            event.getDeviceId(), event.getCreationTime(), tail.getCreationTime());
                    events.add(event);
                }
            } else {
                events.add(event);
            }

            int pruned = prune();
            if (pruned > 0) {
                metrics.recordPruned(pruned);
                log.debug("Pruned {} expired events, {} retained", pruned, events.size());
            }
            return pruned;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Event> query(String deviceId, long since, int max) {
        Event[] snapshot;
        lock.readLock().lock();
        try {
            snapshot = events.toArray(new Event[0]);
        } finally {
            lock.readLock().unlock();
        }

        boolean wildcard = deviceId == null || deviceId.isEmpty();
        List<Event> result = new ArrayList<>();
        for (Event event : snapshot) {
            if (max > 0 && result.size() >= max) {
                break;
            }
            if ((wildcard || event.belongsTo(deviceId)) && event.getCreationTime() >= since) {
                result.add(event);
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return events.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes the expired prefix. Caller must hold the write lock.
     */
    private int prune() {
        if (windowSeconds == 0) {
            return 0;
        }
        long cutoff = clock.instant().getEpochSecond() - windowSeconds;

        int expired = 0;
        while (expired < events.size() && events.get(expired).getCreationTime() < cutoff) {
            expired++;
        }
        if (expired > 0) {
            events.subList(0, expired).clear();
        }
        return expired;
    }

    /**
     * Index of the first event created after the given time. Caller must hold the write lock.
     */
    private int upperBound(long creationTime) {
        int low = 0;
        int high = events.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (events.get(mid).getCreationTime() <= creationTime) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
