package com.koni.eventcache.infrastructure.config;

import com.koni.eventcache.application.decoder.EventDecoder;
import com.koni.eventcache.application.ingestion.ApplicationTerminator;
import com.koni.eventcache.application.ingestion.IngestionLoop;
import com.koni.eventcache.application.ingestion.IngestionSupervisor;
import com.koni.eventcache.application.port.BrokerSubscriptionFactory;
import com.koni.eventcache.domain.repository.EventStore;
import com.koni.eventcache.infrastructure.cache.WindowedEventStore;
import com.koni.eventcache.infrastructure.observability.EventCacheMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root for the event cache.
 *
 * The store is created once here and shared by reference between the ingestion
 * loop (its only writer) and the query handlers.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EventCacheProperties.class)
public class EventCacheConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventStore eventStore(EventCacheProperties properties, Clock clock, EventCacheMetrics metrics) {
        EventCacheProperties.Store settings = properties.getStore();
        WindowedEventStore store = new WindowedEventStore(
                settings.getWindow(),
                settings.getOutOfOrderPolicy(),
                clock,
                metrics);
        metrics.bindStoreSize(store);
        return store;
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventcache.ingestion", name = "enabled", havingValue = "true", matchIfMissing = true)
    public IngestionLoop ingestionLoop(BrokerSubscriptionFactory subscriptionFactory,
                                       EventDecoder decoder,
                                       EventStore eventStore,
                                       EventCacheMetrics metrics,
                                       Clock clock,
                                       EventCacheProperties properties) {
        EventCacheProperties.Broker broker = properties.getBroker();
        return new IngestionLoop(
                subscriptionFactory,
                decoder,
                eventStore,
                metrics,
                clock,
                broker.getTopic(),
                broker.getStartOffset(),
                properties.getStore().getWindow(),
                broker.isSeekByWindow());
    }

    @Bean
    @ConditionalOnProperty(prefix = "eventcache.ingestion", name = "enabled", havingValue = "true", matchIfMissing = true)
    public IngestionSupervisor ingestionSupervisor(IngestionLoop ingestionLoop,
                                                   ApplicationTerminator applicationTerminator,
                                                   EventCacheProperties properties) {
        EventCacheProperties.Ingestion settings = properties.getIngestion();
        return new IngestionSupervisor(
                ingestionLoop,
                settings.getFailurePolicy(),
                applicationTerminator,
                settings.getShutdownTimeout());
    }

    /**
     * Closes the application context from a separate thread so the ingestion
     * thread reporting the failure is not the one waiting for shutdown.
     */
    @Bean
    public ApplicationTerminator applicationTerminator(ConfigurableApplicationContext context) {
        return exitCode -> {
            Thread terminator = new Thread(() -> {
                log.error("Shutting down with exit code {}", exitCode);
                System.exit(SpringApplication.exit(context, () -> exitCode));
            }, "ingestion-terminator");
            terminator.start();
        };
    }
}
