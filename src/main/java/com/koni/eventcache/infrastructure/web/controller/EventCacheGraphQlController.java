package com.koni.eventcache.infrastructure.web.controller;

import com.koni.eventcache.application.query.DeviceResponse;
import com.koni.eventcache.application.query.EventResponse;
import com.koni.eventcache.application.query.ListDevicesQuery;
import com.koni.eventcache.application.query.ListDevicesQueryHandler;
import com.koni.eventcache.application.query.ListEventsQuery;
import com.koni.eventcache.application.query.ListEventsQueryHandler;
import com.koni.eventcache.domain.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

/**
 * GraphQL adapter over the device and event queries (POST /graphql).
 *
 * Schema: src/main/resources/graphql/schema.graphqls. {@code since} is passed as a
 * decimal string because epoch seconds do not fit GraphQL's 32-bit Int.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class EventCacheGraphQlController {

    private final ListDevicesQueryHandler devicesQueryHandler;
    private final ListEventsQueryHandler eventsQueryHandler;

    @QueryMapping
    public List<DeviceResponse> devices() {
        return devicesQueryHandler.handle(new ListDevicesQuery());
    }

    @QueryMapping
    public List<EventResponse> events(@Argument String deviceId,
                                      @Argument Integer max,
                                      @Argument String since) {
        ListEventsQuery query = new ListEventsQuery(
                deviceId,
                max == null ? 0 : max,
                parseSince(since));
        return eventsQueryHandler.handle(query);
    }

    private static long parseSince(String since) {
        if (since == null || since.isBlank()) {
            return 0L;
        }
        try {
            return Long.parseLong(since.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("since must be an integer number of seconds: " + since);
        }
    }
}
