package com.koni.eventcache.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event value object representing one telemetry reading received from the broker.
 * This is an immutable value object; the payload map is copied on construction
 * and exposed read-only.
 *
 * An empty deviceId means "unknown device". Such events are retained like any other
 * but never match a device-specific query.
 */
@Getter
@EqualsAndHashCode
public final class Event {

    private final String deviceId;
    private final long creationTime;
    private final Map<String, Object> data;

    /**
     * Creates a new Event.
     *
     * @param deviceId the device identifier, empty for an unknown device
     * @param creationTime producer-supplied creation time in seconds since epoch
     * @param data the opaque payload, may be null for an empty payload
     */
    public Event(String deviceId, long creationTime, Map<String, Object> data) {
        this.deviceId = deviceId == null ? "" : deviceId;
        this.creationTime = creationTime;
        this.data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Checks whether this event belongs to the given device.
     * An event for an unknown device never matches.
     *
     * @param candidate the device identifier to compare against
     * @return true if both identifiers are non-empty and equal
     */
    public boolean belongsTo(String candidate) {
        return !deviceId.isEmpty() && deviceId.equals(candidate);
    }

    /**
     * Checks whether this event was created strictly before the given event.
     *
     * @param other the event to compare against
     * @return true if this event's creation time is older
     */
    public boolean isOlderThan(Event other) {
        return creationTime < other.creationTime;
    }

    @Override
    public String toString() {
        return "Event{" +
                "deviceId='" + deviceId + '\'' +
                ", creationTime=" + creationTime +
                ", data=" + data +
                '}';
    }
}
