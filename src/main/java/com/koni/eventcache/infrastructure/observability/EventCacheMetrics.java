package com.koni.eventcache.infrastructure.observability;

import com.koni.eventcache.domain.repository.EventStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking event cache metrics.
 * Provides counters for the ingestion path and a timer for queries.
 */
@Slf4j
@Component
public class EventCacheMetrics {

    private final MeterRegistry registry;
    private final Counter eventsAccepted;
    private final Counter eventsRejected;
    private final Counter eventsPruned;
    private final Counter outOfOrderEvents;
    private final Counter eventsDropped;
    private final Timer queryTime;

    public EventCacheMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.eventsAccepted = Counter.builder("eventcache.events.accepted.total")
                .description("Total broker messages decoded and stored")
                .register(registry);

        this.eventsRejected = Counter.builder("eventcache.events.rejected.total")
                .description("Total broker messages rejected because they could not be decoded")
                .register(registry);

        this.eventsPruned = Counter.builder("eventcache.events.pruned.total")
                .description("Total events removed after leaving the retention window")
                .register(registry);

        this.outOfOrderEvents = Counter.builder("eventcache.events.out_of_order.total")
                .description("Total events older than the newest retained event")
                .register(registry);

        this.eventsDropped = Counter.builder("eventcache.events.dropped.total")
                .description("Total out-of-order events discarded by the store")
                .register(registry);

        this.queryTime = Timer.builder("eventcache.query.time")
                .description("Time to answer an event query")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Registers a gauge tracking the number of events retained by the store.
     *
     * @param store the store to observe
     */
    public void bindStoreSize(EventStore store) {
        Gauge.builder("eventcache.store.size", store, EventStore::size)
                .description("Number of events currently retained")
                .register(registry);
    }

    public void recordAccepted() {
        eventsAccepted.increment();
    }

    public void recordRejected() {
        eventsRejected.increment();
        log.debug("Rejected event counter incremented");
    }

    /**
     * Add the number of events removed by one pruning pass.
     *
     * @param count number of pruned events
     */
    public void recordPruned(int count) {
        eventsPruned.increment(count);
    }

    public void recordOutOfOrder() {
        outOfOrderEvents.increment();
        log.debug("Out-of-order event counter incremented");
    }

    public void recordDropped() {
        eventsDropped.increment();
    }

    /**
     * Record the time taken by a query.
     *
     * @param operation The query to time
     * @param <T> The return type of the query
     * @return The result of the query
     */
    public <T> T recordQueryTime(Supplier<T> operation) {
        return queryTime.record(operation);
    }
}
