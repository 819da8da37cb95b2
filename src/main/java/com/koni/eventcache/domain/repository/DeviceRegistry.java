package com.koni.eventcache.domain.repository;

import com.koni.eventcache.domain.model.Device;

import java.util.List;

/**
 * Port for the external device registry.
 * Implemented by an infrastructure adapter that fetches the registry over HTTP.
 */
public interface DeviceRegistry {

    /**
     * Fetches the current list of registered devices.
     *
     * @return the registered devices, or an empty list if none exist
     * @throws com.koni.eventcache.domain.exception.DeviceRegistryUnavailableException
     *         if the registry cannot be reached or its response cannot be parsed
     */
    List<Device> listDevices();
}
