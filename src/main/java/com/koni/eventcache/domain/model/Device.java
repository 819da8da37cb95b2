package com.koni.eventcache.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Device as reported by the external device registry.
 * Read-only; there is no link to cached events beyond the shared device identifier.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Device {

    private final String id;
    private final boolean enabled;
    private final String name;
    private final String description;
    private final List<String> sensors;

    /**
     * Creates a new Device.
     * This constructor is used by Jackson when parsing the registry response.
     *
     * @param id the device identifier
     * @param enabled whether the device is enabled in the registry
     * @param name optional display name
     * @param description optional description
     * @param sensors sensor identifiers, null treated as none
     */
    @JsonCreator
    public Device(
            @JsonProperty("device-id") String id,
            @JsonProperty("enabled") boolean enabled,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("sensors") List<String> sensors) {
        this.id = id;
        this.enabled = enabled;
        this.name = name;
        this.description = description;
        this.sensors = sensors == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(sensors));
    }
}
