package com.koni.eventcache.application.query;

/**
 * Query to retrieve every device known to the device registry.
 * 
 * This is an empty query object as it has no parameters - it simply returns all devices.
 */
public class ListDevicesQuery {
    // No parameters - returns all devices
}
