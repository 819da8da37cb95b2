package com.koni.eventcache.infrastructure.web.controller;

import com.koni.eventcache.application.query.EventResponse;
import com.koni.eventcache.application.query.ListEventsQuery;
import com.koni.eventcache.application.query.ListEventsQueryHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for event queries against the windowed event cache.
 * 
 * Endpoints:
 * - GET /api/v1/events: Retrieve cached events, oldest first
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class EventController {
    
    private final ListEventsQueryHandler queryHandler;
    
    /**
     * Retrieves cached events matching a device, a minimum creation time and a result cap.
     * 
     * Query parameters:
     * - deviceId: device to match; omitted or empty matches every device
     * - max: maximum number of events; 0 or negative means no limit (default 0)
     * - since: minimum creation time in seconds since epoch, inclusive (default 0)
     * 
     * Example request:
     * GET /api/v1/events?deviceId=4711&max=2&since=1717000000
     * 
     * @return 200 OK with a list of EventResponse objects (empty list if nothing matches)
     */
    @GetMapping("/v1/events")
    public ResponseEntity<List<EventResponse>> getEvents(
            @RequestParam(name = "deviceId", required = false) String deviceId,
            @RequestParam(name = "max", defaultValue = "0") int max,
            @RequestParam(name = "since", defaultValue = "0") long since) {
        log.debug("Received request for events: deviceId={}, max={}, since={}", deviceId, max, since);
        
        List<EventResponse> events = queryHandler.handle(new ListEventsQuery(deviceId, max, since));
        
        return ResponseEntity.ok(events);
    }
}
