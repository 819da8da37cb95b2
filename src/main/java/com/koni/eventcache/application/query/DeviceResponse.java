package com.koni.eventcache.application.query;

import com.koni.eventcache.domain.model.Device;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Data Transfer Object representing a device from the registry.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceResponse {

    private String id;
    private boolean enabled;
    private String name;
    private String description;
    private List<String> sensors;

    public static DeviceResponse from(Device device) {
        return new DeviceResponse(
                device.getId(),
                device.isEnabled(),
                device.getName(),
                device.getDescription(),
                device.getSensors()
        );
    }
}
