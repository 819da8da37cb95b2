package com.koni.eventcache.infrastructure.observability;

import com.koni.eventcache.infrastructure.config.EventCacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.TopicDescription;
import org.springframework.boot.actuate.autoconfigure.health.ConditionalOnEnabledHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator for the broker, exposed as "kafka".
 *
 * Describes the event topic; UP with its partition count if the broker answers
 * within five seconds, DOWN otherwise.
 */
@Slf4j
@Component
@ConditionalOnEnabledHealthIndicator("kafka")
public class KafkaHealthIndicator implements HealthIndicator {

    private static final long TIMEOUT_SECONDS = 5;

    private final KafkaAdmin kafkaAdmin;
    private final String topic;

    public KafkaHealthIndicator(KafkaAdmin kafkaAdmin, EventCacheProperties properties) {
        this.kafkaAdmin = kafkaAdmin;
        this.topic = properties.getBroker().getTopic();
    }

    @Override
    public Health health() {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            Map<String, TopicDescription> descriptions = adminClient
                    .describeTopics(Collections.singletonList(topic))
                    .allTopicNames()
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            int partitions = descriptions.get(topic).partitions().size();

            log.debug("Kafka health check passed: topic={}, partitions={}", topic, partitions);

            return Health.up()
                    .withDetail("topic", topic)
                    .withDetail("partitions", partitions)
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return down(e);
        } catch (Exception e) {
            log.error("Kafka health check failed for topic {}", topic, e);
            return down(e);
        }
    }

    private Health down(Exception e) {
        return Health.down()
                .withDetail("topic", topic)
                .withDetail("error", e.getClass().getSimpleName())
                .withDetail("message", String.valueOf(e.getMessage()))
                .build();
    }
}
