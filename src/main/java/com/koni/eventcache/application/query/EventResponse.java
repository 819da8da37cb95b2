package com.koni.eventcache.application.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.eventcache.domain.model.Event;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Data Transfer Object representing one cached event.
 *
 * The payload is opaque to the cache. The recognized sub-fields are projected into
 * typed, optional properties here:
 * - temperature: set only when data.temperature is a number
 * - motion: set only when data.motion is a boolean
 * The full payload is carried in data.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventResponse {

    private String deviceId;
    private long creationTime;
    private Integer temperature;
    private Boolean motion;
    private Map<String, Object> data;

    /**
     * Maps a domain event to its response projection.
     *
     * @param event the cached event
     * @return the projection
     */
    public static EventResponse from(Event event) {
        Object temperature = event.getData().get("temperature");
        Object motion = event.getData().get("motion");
        return new EventResponse(
                event.getDeviceId(),
                event.getCreationTime(),
                temperature instanceof Number ? ((Number) temperature).intValue() : null,
                motion instanceof Boolean ? (Boolean) motion : null,
                event.getData()
        );
    }
}
