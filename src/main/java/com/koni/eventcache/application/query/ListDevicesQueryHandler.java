package com.koni.eventcache.application.query;

import com.koni.eventcache.domain.repository.DeviceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for retrieving the devices known to the external device registry.
 *
 * The registry is queried on every call; nothing is cached. Registry failures
 * propagate to the caller as
 * {@link com.koni.eventcache.domain.exception.DeviceRegistryUnavailableException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ListDevicesQueryHandler {

    private final DeviceRegistry deviceRegistry;

    /**
     * Handles the ListDevicesQuery.
     *
     * @param query the query object (contains no parameters)
     * @return a list of DeviceResponse objects, or an empty list if the registry has none
     */
    public List<DeviceResponse> handle(ListDevicesQuery query) {
        log.debug("Handling ListDevicesQuery");

        List<DeviceResponse> devices = deviceRegistry.listDevices().stream()
                .map(DeviceResponse::from)
                .collect(Collectors.toList());

        log.info("Retrieved {} devices from registry", devices.size());

        return devices;
    }
}
