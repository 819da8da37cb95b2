package com.koni.eventcache.infrastructure.web.controller;

import com.koni.eventcache.application.query.DeviceResponse;
import com.koni.eventcache.application.query.ListDevicesQuery;
import com.koni.eventcache.application.query.ListDevicesQueryHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for device queries.
 * 
 * Endpoints:
 * - GET /api/v1/devices: Retrieve all devices from the device registry
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {
    
    private final ListDevicesQueryHandler queryHandler;
    
    /**
     * Retrieves all devices known to the device registry.
     * 
     * The registry is queried on every request. If it cannot be reached the
     * request fails with 503 Service Unavailable.
     * 
     * Example response:
     * [
     *   {
     *     "id": "4711",
     *     "enabled": true,
     *     "name": "kitchen",
     *     "description": "Kitchen sensor",
     *     "sensors": ["temperature", "motion"]
     *   }
     * ]
     * 
     * @return 200 OK with a list of DeviceResponse objects (empty list if no devices exist)
     */
    @GetMapping("/v1/devices")
    public ResponseEntity<List<DeviceResponse>> getDevices() {
        log.info("Received request to get all devices");
        
        List<DeviceResponse> devices = queryHandler.handle(new ListDevicesQuery());
        
        log.info("Returning {} devices", devices.size());
        
        return ResponseEntity.ok(devices);
    }
}
