package com.koni.eventcache.infrastructure.messaging;

import com.koni.eventcache.application.port.BrokerSubscription;
import com.koni.eventcache.application.port.ReceivedMessage;
import com.koni.eventcache.domain.exception.BrokerUnavailableException;
import com.koni.eventcache.domain.exception.SubscriptionClosedException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka implementation of a broker subscription over a set of assigned partitions.
 *
 * Records are polled in batches of at most {@code max.poll.records} and handed out one at a
 * time; the next poll happens only after every buffered record was acknowledged, which bounds
 * the number of unacknowledged records to the receive credit.
 *
 * Acknowledgment:
 * - accept: synchronously commits the record's offset + 1
 * - reject: publishes the raw record to the reject topic with the failure reason in the
 *   headers, then commits the offset
 *
 * Not thread-safe except for {@link #cancel()}, which wakes up a blocked poll or commit.
 * A commit woken up by a cancel ends the subscription as closed, not failed.
 */
@Slf4j
public class KafkaBrokerSubscription implements BrokerSubscription {

    static final String EXCEPTION_MESSAGE_HEADER = "exception-message";
    static final String ORIGINAL_TOPIC_HEADER = "original-topic";
    static final String ORIGINAL_PARTITION_HEADER = "original-partition";
    static final String ORIGINAL_OFFSET_HEADER = "original-offset";

    private final Consumer<String, byte[]> consumer;
    private final KafkaTemplate<String, byte[]> rejectTemplate;
    private final String rejectTopic;
    private final Duration pollTimeout;
    private final Duration sendTimeout;

    private final Deque<ConsumerRecord<String, byte[]>> buffered = new ArrayDeque<>();
    private KafkaReceivedMessage pending;
    private volatile boolean cancelled;

    public KafkaBrokerSubscription(Consumer<String, byte[]> consumer,
                                   KafkaTemplate<String, byte[]> rejectTemplate,
                                   String rejectTopic,
                                   Duration pollTimeout,
                                   Duration sendTimeout) {
        this.consumer = consumer;
        this.rejectTemplate = rejectTemplate;
        this.rejectTopic = rejectTopic;
        this.pollTimeout = pollTimeout;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public ReceivedMessage receive() {
        if (pending != null && !pending.acknowledged) {
            throw new IllegalStateException("Previous message at offset " + pending.record.offset()
                    + " was neither accepted nor rejected");
        }

        if (cancelled) {
            throw new SubscriptionClosedException("Subscription cancelled");
        }

        while (buffered.isEmpty()) {
            try {
                ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
                records.forEach(buffered::add);
            } catch (WakeupException e) {
                throw new SubscriptionClosedException("Subscription cancelled", e);
            } catch (InterruptException e) {
                throw new SubscriptionClosedException("Ingestion thread interrupted", e);
            } catch (KafkaException e) {
                throw new BrokerUnavailableException("Failed to poll broker: " + e.getMessage(), e);
            }
        }

        pending = new KafkaReceivedMessage(buffered.poll());
        return pending;
    }

    @Override
    public void cancel() {
        cancelled = true;
        consumer.wakeup();
    }

    @Override
    public void close() {
        try {
            consumer.close();
            log.info("Broker subscription closed");
        } catch (KafkaException e) {
            log.warn("Error closing broker subscription: {}", e.getMessage());
        }
    }

    private void commit(ConsumerRecord<String, byte[]> record) {
        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
        try {
            consumer.commitSync(Collections.singletonMap(partition, new OffsetAndMetadata(record.offset() + 1)));
        } catch (WakeupException e) {
            if (cancelled) {
                throw new SubscriptionClosedException("Subscription cancelled before offset "
                        + record.offset() + " on " + partition + " was committed", e);
            }
            throw new BrokerUnavailableException("Unexpected wakeup while committing offset " + record.offset()
                    + " on " + partition, e);
        } catch (InterruptException e) {
            throw new SubscriptionClosedException("Ingestion thread interrupted", e);
        } catch (KafkaException e) {
            throw new BrokerUnavailableException("Failed to commit offset " + record.offset()
                    + " on " + partition + ": " + e.getMessage(), e);
        }
    }

    private void publishRejected(ConsumerRecord<String, byte[]> record, String reason) {
        ProducerRecord<String, byte[]> rejected = new ProducerRecord<>(rejectTopic, null, record.key(), record.value());
        rejected.headers()
                .add(EXCEPTION_MESSAGE_HEADER, bytes(reason == null ? "unknown" : reason))
                .add(ORIGINAL_TOPIC_HEADER, bytes(record.topic()))
                .add(ORIGINAL_PARTITION_HEADER, bytes(String.valueOf(record.partition())))
                .add(ORIGINAL_OFFSET_HEADER, bytes(String.valueOf(record.offset())));

        try {
            rejectTemplate.send(rejected).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while publishing rejected message", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new BrokerUnavailableException("Failed to publish rejected message to " + rejectTopic, e);
        }

        log.debug("Rejected message published: topic={}, sourcePartition={}, sourceOffset={}",
                rejectTopic, record.partition(), record.offset());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * A polled record awaiting exactly one acknowledgment.
     */
    private final class KafkaReceivedMessage implements ReceivedMessage {

        private final ConsumerRecord<String, byte[]> record;
        private boolean acknowledged;

        private KafkaReceivedMessage(ConsumerRecord<String, byte[]> record) {
            this.record = record;
        }

        @Override
        public byte[] body() {
            return record.value() == null ? new byte[0] : record.value();
        }

        @Override
        public void accept() {
            markAcknowledged();
            commit(record);
        }

        @Override
        public void reject(String reason) {
            markAcknowledged();
            publishRejected(record, reason);
            commit(record);
        }

        private void markAcknowledged() {
            if (acknowledged) {
                throw new IllegalStateException("Message at offset " + record.offset() + " already acknowledged");
            }
            acknowledged = true;
        }
    }
}
