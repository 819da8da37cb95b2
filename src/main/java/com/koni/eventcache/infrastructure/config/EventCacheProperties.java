package com.koni.eventcache.infrastructure.config;

import com.koni.eventcache.application.ingestion.FailurePolicy;
import com.koni.eventcache.domain.repository.OutOfOrderPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the event cache.
 *
 * Loaded from the {@code eventcache} section of application.yml.
 * Broker connection settings (bootstrap servers, group id) live under {@code spring.kafka}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "eventcache")
public class EventCacheProperties {

    @Valid
    private Broker broker = new Broker();

    @Valid
    private Store store = new Store();

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private Registry registry = new Registry();

    @Data
    public static class Broker {

        /**
         * Topic carrying device events
         */
        @NotBlank(message = "Event topic is required")
        private String topic = "events";

        /**
         * Offset to start from on every partition; -1 for latest.
         * Ignored when seeking by window.
         */
        @Min(value = -1, message = "Start offset must be -1 (latest) or a non-negative offset")
        private long startOffset = 0;

        /**
         * When a retention window is set, start from the first record published
         * inside the window instead of the start offset
         */
        private boolean seekByWindow = true;

        /**
         * Maximum number of records fetched per poll and held unacknowledged
         */
        @Min(value = 1, message = "Receive credit must be at least 1")
        private int receiveCredit = 10;

        /**
         * Topic receiving rejected messages; defaults to "<topic>.dlq"
         */
        private String rejectTopic;

        @NotNull
        private Duration pollTimeout = Duration.ofSeconds(1);

        @NotNull
        private Duration metadataTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration sendTimeout = Duration.ofSeconds(10);

        public String resolveRejectTopic(String sourceTopic) {
            return rejectTopic == null || rejectTopic.isBlank() ? sourceTopic + ".dlq" : rejectTopic;
        }
    }

    @Data
    public static class Store {

        /**
         * Retention window. Zero disables pruning and must be chosen explicitly.
         */
        @NotNull
        private Duration window = Duration.ofHours(1);

        @NotNull
        private OutOfOrderPolicy outOfOrderPolicy = OutOfOrderPolicy.RETAIN;

        @AssertTrue(message = "Store window must be a whole number of seconds")
        public boolean isWindowInWholeSeconds() {
            return window == null || window.getNano() == 0;
        }
    }

    @Data
    public static class Ingestion {

        /**
         * Start the ingestion loop with the application
         */
        private boolean enabled = true;

        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.TERMINATE;

        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Registry {

        /**
         * Base URL of the device registration API
         */
        @NotBlank(message = "Device registry URL is required")
        private String url = "https://manage.bosch-iot-hub.com/registration";

        /**
         * Tenant appended to the URL path; also used to derive the default username
         */
        private String tenantId;

        private String username;

        private String password;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        public String resolveUrl() {
            if (tenantId == null || tenantId.isBlank()) {
                return url;
            }
            return url.endsWith("/") ? url + tenantId : url + "/" + tenantId;
        }

        public String resolveUsername() {
            if ((username == null || username.isBlank()) && tenantId != null && !tenantId.isBlank()) {
                return "device-registry@" + tenantId;
            }
            return username;
        }
    }
}
