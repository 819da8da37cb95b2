package com.koni.eventcache.infrastructure.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.koni.eventcache.domain.model.Device;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response body of the device registration API.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceRegistryResponse {

    private List<Device> devices;
}
