package com.koni.eventcache.infrastructure.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.eventcache.domain.repository.DeviceRegistry;
import com.koni.eventcache.infrastructure.config.EventCacheProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration for the device registration API client.
 *
 * The request URL is the registry URL with the tenant appended when one is
 * configured. Basic authentication is sent on every request when a username
 * is available.
 */
@Slf4j
@Configuration
public class DeviceRegistryClientConfig {

    @Bean
    public RestClient deviceRegistryRestClient(RestClient.Builder builder, EventCacheProperties properties) {
        EventCacheProperties.Registry registry = properties.getRegistry();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) registry.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) registry.getReadTimeout().toMillis());

        String username = registry.resolveUsername();

        RestClient.Builder configured = builder.clone().requestFactory(requestFactory);
        if (username != null && !username.isBlank()) {
            String password = registry.getPassword() == null ? "" : registry.getPassword();
            configured.defaultHeaders(headers -> headers.setBasicAuth(username, password));
        } else {
            log.warn("No device registry credentials configured; requests are sent unauthenticated");
        }
        return configured.build();
    }

    @Bean
    public DeviceRegistry deviceRegistry(RestClient deviceRegistryRestClient,
                                         EventCacheProperties properties,
                                         ObjectMapper objectMapper,
                                         CircuitBreaker deviceRegistryCircuitBreaker) {
        String url = properties.getRegistry().resolveUrl();
        log.info("Device registry client configured: url={}, user={}", url, properties.getRegistry().resolveUsername());
        return new RestDeviceRegistryClient(deviceRegistryRestClient, url, objectMapper, deviceRegistryCircuitBreaker);
    }
}
