package com.koni.eventcache.application.query;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Query to retrieve cached events, oldest first.
 *
 * - deviceId: the device to match; empty or null for every device when wildcards are allowed
 * - max: maximum number of results; zero or negative means no limit
 * - since: minimum creation time in seconds since epoch, inclusive
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ListEventsQuery {

    private final String deviceId;
    private final int max;
    private final long since;
}
