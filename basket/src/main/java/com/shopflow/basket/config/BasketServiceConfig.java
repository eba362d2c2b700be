package com.shopflow.basket.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.shared.events.EventSerializer;
import com.shopflow.shared.kafka.AdminClientHealthCheck;
import com.shopflow.shared.kafka.BrokerConnectionManager;
import com.shopflow.shared.kafka.BrokerHealthCheck;
import com.shopflow.shared.kafka.BrokerProperties;
import com.shopflow.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.HashMap;
import java.util.Map;

/**
 * Basket Service Spring Configuration
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({BrokerProperties.class, CheckoutProperties.class})
public class BasketServiceConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    // ─── Broker ───────────────────────────────────────────────────────────────

    @Bean
    public ProducerFactory<String, String> producerFactory(BrokerProperties brokerProperties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, brokerProperties.getClientId());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // Idempotent producer: broker-side retries never duplicate a checkout message
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 1000);

        // send() must not block past the synchronous publish bound waiting for metadata
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (int) brokerProperties.getSendTimeout().toMillis());

        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "gzip");
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public BrokerHealthCheck brokerHealthCheck(BrokerProperties brokerProperties) {
        return new AdminClientHealthCheck(bootstrapServers, brokerProperties.getClientId());
    }

    @Bean
    public BrokerConnectionManager brokerConnectionManager(BrokerProperties brokerProperties,
                                                           ProducerFactory<String, String> producerFactory,
                                                           BrokerHealthCheck brokerHealthCheck) {
        return new BrokerConnectionManager(brokerProperties, producerFactory, null, brokerHealthCheck);
    }

    @Bean
    public EventPublisher eventPublisher(BrokerConnectionManager brokerConnectionManager,
                                         EventSerializer eventSerializer,
                                         BrokerProperties brokerProperties,
                                         MeterRegistry meterRegistry) {
        return new EventPublisher(brokerConnectionManager, eventSerializer, brokerProperties, meterRegistry);
    }

    // ─── Jackson ──────────────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        return EventSerializer.createObjectMapper();
    }
}
