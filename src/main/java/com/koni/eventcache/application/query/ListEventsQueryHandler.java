package com.koni.eventcache.application.query;

import com.koni.eventcache.domain.exception.ValidationException;
import com.koni.eventcache.domain.repository.EventStore;
import com.koni.eventcache.infrastructure.observability.EventCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for retrieving events from the windowed event cache.
 *
 * Safe to call from any number of request threads while the ingestion loop
 * is writing to the store; each call works on its own snapshot.
 *
 * An empty deviceId matches every device unless wildcard queries are disabled,
 * in which case it is rejected with a {@link ValidationException} rather than
 * answered with an empty list.
 */
@Slf4j
@Service
public class ListEventsQueryHandler {

    private final EventStore eventStore;
    private final EventCacheMetrics metrics;
    private final boolean wildcardDeviceId;

    public ListEventsQueryHandler(
            EventStore eventStore,
            EventCacheMetrics metrics,
            @Value("${eventcache.query.wildcard-device-id:true}") boolean wildcardDeviceId) {
        this.eventStore = eventStore;
        this.metrics = metrics;
        this.wildcardDeviceId = wildcardDeviceId;
    }

    /**
     * Handles the ListEventsQuery.
     *
     * @param query the filter: device, minimum creation time and result cap
     * @return the matching events in store order, or an empty list if none match
     * @throws ValidationException if deviceId is empty and wildcard queries are disabled
     */
    public List<EventResponse> handle(ListEventsQuery query) {
        log.debug("Handling {}", query);

        String deviceId = query.getDeviceId() == null ? "" : query.getDeviceId();
        if (deviceId.isEmpty() && !wildcardDeviceId) {
            throw new ValidationException("deviceId is required");
        }

        List<EventResponse> events = metrics.recordQueryTime(() ->
                eventStore.query(deviceId, query.getSince(), query.getMax()).stream()
                        .map(EventResponse::from)
                        .collect(Collectors.toList()));

        log.debug("Returning {} events for deviceId='{}'", events.size(), deviceId);

        return events;
    }
}
