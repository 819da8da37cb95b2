package com.koni.eventcache.integration;

import com.koni.eventcache.tags.IntegrationTest;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.test.utils.KafkaTestUtils;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end test of the ingestion path against a real broker.
 *
 * 1. Publish a valid and an undecodable event to the event topic
 * 2. Verify the valid event is served by GET /api/v1/events
 * 3. Verify the undecodable one lands on the reject topic with its reason
 *
 * Skipped when Docker is not available.
 */
@IntegrationTest
@SpringBootTest(properties = {
        "eventcache.ingestion.enabled=true",
        "eventcache.ingestion.failure-policy=DEGRADED",
        "eventcache.broker.topic=it-events",
        "eventcache.broker.seek-by-window=false",
        "eventcache.broker.start-offset=0",
        "spring.kafka.admin.auto-create=true"
})
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class KafkaIngestionIntegrationTest {

    private static final String TOPIC = "it-events";
    private static final String REJECT_TOPIC = "it-events.dlq";

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0")
    );

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
    }

    @TestConfiguration
    static class EventTopicConfig {

        @Bean
        NewTopic eventTopic() {
            return TopicBuilder.name(TOPIC).partitions(2).replicas(1).build();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private KafkaTemplate<String, byte[]> kafkaTemplate;

    private Consumer<String, byte[]> rejectConsumer;

    @BeforeEach
    void setUp() {
        Map<String, Object> consumerProps = KafkaTestUtils.consumerProps(
                kafka.getBootstrapServers(),
                "reject-test-group",
                "true"
        );
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        rejectConsumer = new DefaultKafkaConsumerFactory<String, byte[]>(consumerProps).createConsumer();
        rejectConsumer.subscribe(Collections.singletonList(REJECT_TOPIC));
    }

    @AfterEach
    void tearDown() {
        if (rejectConsumer != null) {
            rejectConsumer.close(Duration.ofSeconds(2));
        }
    }

    private void publish(String body) throws Exception {
        kafkaTemplate.send(new ProducerRecord<>(TOPIC, body.getBytes(StandardCharsets.UTF_8)))
                .get(10, TimeUnit.SECONDS);
    }

    @Test
    void shouldCacheValidEventsAndRejectUndecodableOnes() throws Exception {
        // Given
        long now = Instant.now().getEpochSecond();

        // When
        publish("{\"deviceId\":\"it-1\",\"creationTime\":" + now + ",\"data\":{\"temperature\":19,\"motion\":true}}");
        publish("{\"deviceId\": \"it-1\"}");

        // Then - valid event is queryable
        await().atMost(Duration.ofSeconds(30))
                .untilAsserted(() -> mockMvc.perform(get("/api/v1/events").param("deviceId", "it-1"))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.length()").value(1))
                        .andExpect(jsonPath("$[0].temperature").value(19))
                        .andExpect(jsonPath("$[0].motion").value(true)));

        // Then - undecodable event was forwarded to the reject topic
        ConsumerRecord<String, byte[]> rejected =
                KafkaTestUtils.getSingleRecord(rejectConsumer, REJECT_TOPIC, Duration.ofSeconds(30));
        assertThat(new String(rejected.value(), StandardCharsets.UTF_8)).isEqualTo("{\"deviceId\": \"it-1\"}");
        assertThat(new String(rejected.headers().lastHeader("original-topic").value(), StandardCharsets.UTF_8))
                .isEqualTo(TOPIC);
        assertThat(new String(rejected.headers().lastHeader("exception-message").value(), StandardCharsets.UTF_8))
                .contains("creationTime");

        // Then - ingestion reports healthy
        mockMvc.perform(get("/actuator/health/ingestion"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.details.state").value("RUNNING"));
    }
}
