package com.koni.eventcache.infrastructure.messaging;

import com.koni.eventcache.infrastructure.config.EventCacheProperties;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration for the event cache.
 * 
 * The event topic itself belongs to the producers and is not created here.
 * Only the reject topic, which this service writes to, is declared so that
 * it exists on application startup.
 */
@Configuration
public class KafkaTopicConfig {
    
    @Value("${eventcache.broker.reject-partitions:1}")
    private int partitions;
    
    @Value("${eventcache.broker.reject-replication-factor:1}")
    private short replicationFactor;
    
    /**
     * Creates the reject topic configuration.
     * 
     * Replication Factor: 1 by default (for development; should be 3 in production for fault tolerance)
     * 
     * @return NewTopic configuration for the reject topic
     */
    @Bean
    public NewTopic rejectTopic(EventCacheProperties properties) {
        EventCacheProperties.Broker broker = properties.getBroker();
        return TopicBuilder.name(broker.resolveRejectTopic(broker.getTopic()))
                .partitions(partitions)
                .replicas(replicationFactor)
                .build();
    }
}
