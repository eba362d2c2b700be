package com.shopflow.order.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.shared.events.EventSerializer;
import com.shopflow.shared.kafka.AdminClientHealthCheck;
import com.shopflow.shared.kafka.BrokerConnectionManager;
import com.shopflow.shared.kafka.BrokerHealthCheck;
import com.shopflow.shared.kafka.BrokerProperties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Ordering Service Spring Configuration
 */
@Configuration
@EnableConfigurationProperties({BrokerProperties.class, CheckoutConsumerProperties.class})
public class OrderServiceConfig {

    static final long REDELIVERY_INITIAL_INTERVAL_MS = 1_000L;
    static final double REDELIVERY_MULTIPLIER = 2.0;
    static final long REDELIVERY_MAX_INTERVAL_MS = 30_000L;

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    // ─── Kafka Consumer ───────────────────────────────────────────────────────

    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // A checkout published before the group first joined must still become an order
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        // Manual acknowledgment: offsets commit only after the dispatcher is done
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);

        // One checkout at a time per poll
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 1);

        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 3000);
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        props.put(ConsumerConfig.RECONNECT_BACKOFF_MAX_MS_CONFIG, 10000);

        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public BrokerHealthCheck brokerHealthCheck(BrokerProperties brokerProperties) {
        return new AdminClientHealthCheck(bootstrapServers, brokerProperties.getClientId());
    }

    @Bean
    public BrokerConnectionManager brokerConnectionManager(BrokerProperties brokerProperties,
                                                           ConsumerFactory<String, String> consumerFactory,
                                                           BrokerHealthCheck brokerHealthCheck) {
        return new BrokerConnectionManager(brokerProperties, null, consumerFactory, brokerHealthCheck);
    }

    /**
     * Redelivery for messages left unacknowledged (order store down): exponential
     * backoff 1s, 2s, 4s … capped at 30s, no attempt limit. Nothing is dead-lettered.
     */
    @Bean
    public CommonErrorHandler checkoutErrorHandler() {
        ExponentialBackOff backOff = new ExponentialBackOff(REDELIVERY_INITIAL_INTERVAL_MS, REDELIVERY_MULTIPLIER);
        backOff.setMaxInterval(REDELIVERY_MAX_INTERVAL_MS);
        return new DefaultErrorHandler(backOff);
    }

    // ─── Jackson ──────────────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        return EventSerializer.createObjectMapper();
    }
}
