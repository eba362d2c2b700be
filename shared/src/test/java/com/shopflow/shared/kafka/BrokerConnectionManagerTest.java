package com.shopflow.shared.kafka;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Connection resilience without a broker: the health check is a switchable fake.
 */
@ExtendWith(MockitoExtension.class)
class BrokerConnectionManagerTest {

    @Mock ProducerFactory<String, String> producerFactory;
    @Mock ConsumerFactory<String, String> consumerFactory;

    FakeBroker broker;
    BrokerConnectionManager manager;

    @BeforeEach
    void setUp() {
        broker = new FakeBroker();
        manager = new BrokerConnectionManager(new BrokerProperties(), producerFactory, consumerFactory, broker);
    }

    // ─── Connecting ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("construction never contacts the broker")
    void construction_doesNotCheck() {
        assertThat(manager.getState()).isEqualTo(BrokerConnectionManager.State.DISCONNECTED);
        assertThat(manager.isConnected()).isFalse();
        assertThat(broker.checks.get()).isZero();
    }

    @Test
    @DisplayName("broker down then up — first use fails FAULTED, next use connects without restart")
    void brokerDownThenUp_reconnectsOnNextUse() {
        broker.up.set(false);

        assertThatThrownBy(() -> manager.producerChannel())
                .isInstanceOf(BrokerUnavailableException.class);
        assertThat(manager.getState()).isEqualTo(BrokerConnectionManager.State.FAULTED);

        broker.up.set(true);
        KafkaTemplate<String, String> channel = manager.producerChannel();

        assertThat(channel).isNotNull();
        assertThat(manager.isConnected()).isTrue();
        assertThat(broker.checks.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("producer channel is shared and connected managers do not re-check")
    void producerChannel_isShared() {
        KafkaTemplate<String, String> first = manager.producerChannel();
        KafkaTemplate<String, String> second = manager.producerChannel();

        assertThat(second).isSameAs(first);
        assertThat(broker.checks.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("markFaulted — next channel request checks again")
    void markFaulted_forcesRecheck() {
        manager.connect();

        manager.markFaulted(new RuntimeException("connection reset"));

        assertThat(manager.getState()).isEqualTo(BrokerConnectionManager.State.FAULTED);
        manager.producerChannel();
        assertThat(manager.isConnected()).isTrue();
        assertThat(broker.checks.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("markFaulted — ignored unless connected")
    void markFaulted_ignoredWhenDisconnected() {
        manager.markFaulted(new RuntimeException("late failure"));

        assertThat(manager.getState()).isEqualTo(BrokerConnectionManager.State.DISCONNECTED);
    }

    // ─── Consumer channels ────────────────────────────────────────────────────

    @Test
    @DisplayName("consumer channel — manual ack, group id, not started, broker down is tolerated")
    void createConsumerChannel_configuresContainer() {
        broker.up.set(false);
        AcknowledgingMessageListener<String, String> listener = (record, ack) -> { };

        KafkaMessageListenerContainer<String, String> container =
                manager.createConsumerChannel("basket_checkout_queue", "ordering-service", listener, null);

        ContainerProperties props = container.getContainerProperties();
        assertThat(props.getTopics()).containsExactly("basket_checkout_queue");
        assertThat(props.getGroupId()).isEqualTo("ordering-service");
        assertThat(props.getAckMode()).isEqualTo(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        assertThat(props.getMessageListener()).isSameAs(listener);
        assertThat(container.isRunning()).isFalse();
        assertThat(broker.checks.get()).isEqualTo(1);
        assertThat(manager.getState()).isEqualTo(BrokerConnectionManager.State.FAULTED);
    }

    @Test
    @DisplayName("consume-only manager — connected after probing, and after partitions are assigned once the broker is back")
    void consumeOnly_tracksConnectionState() {
        BrokerConnectionManager consumeOnly =
                new BrokerConnectionManager(new BrokerProperties(), null, consumerFactory, broker);

        consumeOnly.createConsumerChannel("basket_checkout_queue", "ordering-service", new Object(), null);
        assertThat(consumeOnly.isConnected()).isTrue();

        broker.up.set(false);
        consumeOnly.markFaulted(new RuntimeException("connection reset"));
        KafkaMessageListenerContainer<String, String> container =
                consumeOnly.createConsumerChannel("basket_checkout_queue", "ordering-service", new Object(), null);
        assertThat(consumeOnly.getState()).isEqualTo(BrokerConnectionManager.State.FAULTED);

        ConsumerRebalanceListener rebalanceListener = container.getContainerProperties().getConsumerRebalanceListener();
        rebalanceListener.onPartitionsAssigned(List.of(new TopicPartition("basket_checkout_queue", 0)));

        assertThat(consumeOnly.isConnected()).isTrue();
    }

    @Test
    @DisplayName("producer close is bounded by the configured close timeout")
    void producerCloseTimeout_fromProperties() {
        BrokerProperties properties = new BrokerProperties();
        properties.setCloseTimeout(Duration.ofSeconds(7));
        DefaultKafkaProducerFactory<String, String> factory = new DefaultKafkaProducerFactory<>(Map.of());

        new BrokerConnectionManager(properties, factory, null, broker);

        assertThat(factory.getPhysicalCloseTimeout()).isEqualTo(Duration.ofSeconds(7));
    }

    // ─── Closing ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("close — releases the producer and health check once, returns to DISCONNECTED")
    void close_isIdempotent() {
        manager.producerChannel();

        manager.close();
        manager.close();
        manager.destroy();

        assertThat(manager.getState()).isEqualTo(BrokerConnectionManager.State.DISCONNECTED);
        assertThat(manager.isClosed()).isTrue();
        verify(producerFactory, times(1)).reset();
        assertThat(broker.closes.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("close — closed manager refuses new channels")
    void close_refusesNewChannels() {
        manager.close();

        assertThatThrownBy(() -> manager.producerChannel()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> manager.createConsumerChannel("t", "g", new Object(), null))
                .isInstanceOf(IllegalStateException.class);
    }

    static class FakeBroker implements BrokerHealthCheck {
        final AtomicBoolean up = new AtomicBoolean(true);
        final AtomicInteger checks = new AtomicInteger();
        final AtomicInteger closes = new AtomicInteger();

        @Override
        public void verify(Duration timeout) throws Exception {
            checks.incrementAndGet();
            if (!up.get()) {
                throw new java.net.ConnectException("Connection refused");
            }
        }

        @Override
        public void close(Duration timeout) {
            closes.incrementAndGet();
        }
    }
}
