package com.koni.eventcache.infrastructure.messaging;

import com.koni.eventcache.infrastructure.config.EventCacheProperties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumer configuration for reading raw device events.
 * 
 * Configuration features:
 * - Raw byte[] values; decoding happens in the ingestion loop so a malformed
 *   body can be rejected instead of failing inside the deserializer
 * - Auto-commit disabled; offsets are committed per message on accept/reject
 * - max.poll.records bounded by the configured receive credit
 */
@Configuration
public class KafkaConsumerConfig {
    
    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;
    
    @Value("${spring.kafka.consumer.group-id}")
    private String groupId;
    
    @Value("${spring.kafka.consumer.auto-offset-reset:earliest}")
    private String autoOffsetReset;
    
    /**
     * Creates a ConsumerFactory for raw event payloads.
     */
    @Bean
    public ConsumerFactory<String, byte[]> eventConsumerFactory(EventCacheProperties properties) {
        Map<String, Object> configProps = new HashMap<>();
        
        // Bootstrap servers
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        
        // Consumer group, used only to record committed offsets
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        
        // Offset management
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        
        // Receive credit
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, properties.getBroker().getReceiveCredit());
        
        return new DefaultKafkaConsumerFactory<>(
                configProps,
                new StringDeserializer(),
                new ByteArrayDeserializer()
        );
    }
}
