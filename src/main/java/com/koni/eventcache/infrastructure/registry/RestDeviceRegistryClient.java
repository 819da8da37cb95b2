package com.koni.eventcache.infrastructure.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.eventcache.domain.exception.DeviceRegistryUnavailableException;
import com.koni.eventcache.domain.model.Device;
import com.koni.eventcache.domain.repository.DeviceRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * HTTP implementation of the DeviceRegistry port.
 *
 * Issues a GET with basic authentication against the configured registration URL and
 * parses the {@code devices} array of the response. Calls go through a circuit breaker;
 * when it is open the call fails fast. Previous responses are not cached and failed
 * calls are not retried.
 */
@Slf4j
public class RestDeviceRegistryClient implements DeviceRegistry {

    private final RestClient restClient;
    private final String registryUrl;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public RestDeviceRegistryClient(RestClient restClient,
                                    String registryUrl,
                                    ObjectMapper objectMapper,
                                    CircuitBreaker circuitBreaker) {
        this.restClient = restClient;
        this.registryUrl = registryUrl;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public List<Device> listDevices() {
        Supplier<List<Device>> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, this::fetchDevices);
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("Device registry circuit breaker is OPEN, failing fast");
            throw new DeviceRegistryUnavailableException("Device registry temporarily unavailable", e);
        }
    }

    private List<Device> fetchDevices() {
        String body;
        try {
            body = restClient.get()
                    .uri(registryUrl)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            log.error("Device registry request failed: {}", e.getMessage());
            throw new DeviceRegistryUnavailableException("Device registry request failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new DeviceRegistryUnavailableException("Device registry returned an empty response");
        }

        DeviceRegistryResponse response;
        try {
            response = objectMapper.readValue(body, DeviceRegistryResponse.class);
        } catch (JsonProcessingException e) {
            log.error("Device registry returned malformed JSON: {}", e.getOriginalMessage());
            throw new DeviceRegistryUnavailableException("Device registry returned malformed JSON", e);
        }

        List<Device> devices = response.getDevices() == null ? Collections.emptyList() : response.getDevices();
        log.debug("Device registry returned {} devices", devices.size());
        return devices;
    }
}
