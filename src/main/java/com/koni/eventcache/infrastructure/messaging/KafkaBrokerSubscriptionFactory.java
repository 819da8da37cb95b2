package com.koni.eventcache.infrastructure.messaging;

import com.koni.eventcache.application.port.BrokerSubscription;
import com.koni.eventcache.application.port.BrokerSubscriptionFactory;
import com.koni.eventcache.domain.exception.BrokerUnavailableException;
import com.koni.eventcache.infrastructure.config.EventCacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndTimestamp;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Opens Kafka subscriptions for the ingestion loop.
 *
 * Every partition of the topic is assigned to the consumer explicitly: each instance of the
 * service keeps its own cache and needs the full stream, so partitions are not shared through
 * consumer group rebalancing. The group id is still used to record committed offsets.
 *
 * Connection or metadata failures are reported as {@link BrokerUnavailableException}; there is
 * no retry here.
 */
@Slf4j
@Component
public class KafkaBrokerSubscriptionFactory implements BrokerSubscriptionFactory {

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final KafkaTemplate<String, byte[]> rejectTemplate;
    private final EventCacheProperties.Broker settings;

    public KafkaBrokerSubscriptionFactory(ConsumerFactory<String, byte[]> consumerFactory,
                                          KafkaTemplate<String, byte[]> rejectTemplate,
                                          EventCacheProperties properties) {
        this.consumerFactory = consumerFactory;
        this.rejectTemplate = rejectTemplate;
        this.settings = properties.getBroker();
    }

    @Override
    public BrokerSubscription connect(String topic, long offset) {
        Consumer<String, byte[]> consumer = consumerFactory.createConsumer();
        try {
            List<TopicPartition> partitions = assignAll(consumer, topic);
            if (offset == LATEST) {
                consumer.seekToEnd(partitions);
            } else {
                partitions.forEach(partition -> consumer.seek(partition, offset));
            }
            log.info("Connected to topic {}: partitions={}, startOffset={}",
                    topic, partitions.size(), offset == LATEST ? "latest" : offset);
            return open(consumer, topic);
        } catch (RuntimeException e) {
            throw closeAndWrap(consumer, topic, e);
        }
    }

    @Override
    public BrokerSubscription connectSince(String topic, Instant since) {
        Consumer<String, byte[]> consumer = consumerFactory.createConsumer();
        try {
            List<TopicPartition> partitions = assignAll(consumer, topic);

            Map<TopicPartition, Long> timestamps = new HashMap<>();
            partitions.forEach(partition -> timestamps.put(partition, since.toEpochMilli()));
            Map<TopicPartition, OffsetAndTimestamp> offsets =
                    consumer.offsetsForTimes(timestamps, settings.getMetadataTimeout());

            List<TopicPartition> noNewerRecords = new ArrayList<>();
            for (TopicPartition partition : partitions) {
                OffsetAndTimestamp found = offsets == null ? null : offsets.get(partition);
                if (found == null) {
                    noNewerRecords.add(partition);
                } else {
                    consumer.seek(partition, found.offset());
                }
            }
            if (!noNewerRecords.isEmpty()) {
                consumer.seekToEnd(noNewerRecords);
            }

            log.info("Connected to topic {}: partitions={}, since={}", topic, partitions.size(), since);
            return open(consumer, topic);
        } catch (RuntimeException e) {
            throw closeAndWrap(consumer, topic, e);
        }
    }

    private List<TopicPartition> assignAll(Consumer<String, byte[]> consumer, String topic) {
        List<PartitionInfo> infos = consumer.partitionsFor(topic, settings.getMetadataTimeout());
        if (infos == null || infos.isEmpty()) {
            throw new BrokerUnavailableException("Topic " + topic + " does not exist or has no partitions");
        }
        List<TopicPartition> partitions = infos.stream()
                .map(info -> new TopicPartition(info.topic(), info.partition()))
                .collect(Collectors.toList());
        consumer.assign(partitions);
        return partitions;
    }

    private BrokerSubscription open(Consumer<String, byte[]> consumer, String topic) {
        return new KafkaBrokerSubscription(
                consumer,
                rejectTemplate,
                settings.resolveRejectTopic(topic),
                settings.getPollTimeout(),
                settings.getSendTimeout());
    }

    private static RuntimeException closeAndWrap(Consumer<String, byte[]> consumer, String topic, RuntimeException e) {
        try {
            consumer.close(Duration.ZERO);
        } catch (KafkaException closeError) {
            e.addSuppressed(closeError);
        }
        if (e instanceof BrokerUnavailableException) {
            return e;
        }
        return new BrokerUnavailableException("Failed to subscribe to topic " + topic + ": " + e.getMessage(), e);
    }
}
