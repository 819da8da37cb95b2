package com.koni.eventcache.domain.repository;

import com.koni.eventcache.domain.model.Event;

import java.util.List;

/**
 * Store interface for the windowed event cache.
 * This interface is part of the domain layer and defines the contract for
 * retaining recently received events without coupling to a concrete implementation.
 *
 * Mutation is single-writer: only the ingestion loop calls {@link #insert(Event)}.
 * Queries may run concurrently with each other and with the writer, and always
 * observe the store either before or after a complete insertion.
 */
public interface EventStore {

    /**
     * Appends an event and prunes every event that fell out of the retention window.
     *
     * @param event the event to retain
     * @return the number of events removed by pruning
     * @throws IllegalArgumentException if event is null
     */
    int insert(Event event);

    /**
     * Returns the retained events matching the filter, oldest first.
     *
     * A null or empty deviceId matches every device; callers that do not allow
     * wildcard queries must reject such input before calling.
     * A max of zero or less means no limit, not no results.
     *
     * @param deviceId the device to match, or empty for all devices
     * @param since the minimum creation time, inclusive, in seconds since epoch
     * @param max the maximum number of results, zero or negative for unbounded
     * @return an immutable snapshot of the matching events, never null
     */
    List<Event> query(String deviceId, long since, int max);

    /**
     * Returns the number of events currently retained.
     *
     * @return the retained event count
     */
    int size();
}
