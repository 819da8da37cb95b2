package com.koni.eventcache.domain.repository;

/**
 * How the event store handles an event whose creation time is older than
 * the newest event already retained.
 *
 * Pruning scans from the head and stops at the first event still inside the window,
 * so an old event appended behind newer ones is only removed once everything
 * in front of it has expired.
 */
public enum OutOfOrderPolicy {

    /**
     * Append at the tail as received.
     */
    RETAIN,

    /**
     * Discard the event.
     */
    DROP,

    /**
     * Insert at its sorted position so the sequence stays ordered by creation time.
     */
    SORTED_INSERT
}
