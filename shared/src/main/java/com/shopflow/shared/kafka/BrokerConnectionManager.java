package com.shopflow.shared.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListenerContainer;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Broker Connection Manager
 *
 * Owns the process-wide broker client for one service instance and hands out
 * channels over it:
 *  - producer channel: one shared, thread-safe KafkaTemplate over the shared producer
 *  - consumer channel: a new single-threaded listener container per subscription
 *
 * State machine:
 *   DISCONNECTED → CONNECTING → CONNECTED → FAULTED → (next use) CONNECTING
 *
 * Construction never touches the network. The first producer request checks the
 * broker; a failed check leaves the manager FAULTED and the following request
 * checks again, so a broker that comes up after the service needs no restart.
 * A consume-only service gets the same signal from its channels: creating one
 * checks without failing, and a partition assignment marks the manager CONNECTED.
 *
 * Passed explicitly to the publisher and subscriber; there is no static access.
 */
@Slf4j
public class BrokerConnectionManager implements DisposableBean, AutoCloseable {

    public enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        FAULTED
    }

    private final BrokerProperties properties;
    private final ProducerFactory<String, String> producerFactory;
    private final ConsumerFactory<String, String> consumerFactory;
    private final BrokerHealthCheck healthCheck;

    private final Object lock = new Object();
    private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
    private final List<MessageListenerContainer> containers = new CopyOnWriteArrayList<>();

    private volatile KafkaTemplate<String, String> template;
    private volatile boolean closed;

    /**
     * @param producerFactory may be null for a consume-only service
     * @param consumerFactory may be null for a publish-only service
     */
    public BrokerConnectionManager(BrokerProperties properties,
                                   ProducerFactory<String, String> producerFactory,
                                   ConsumerFactory<String, String> consumerFactory,
                                   BrokerHealthCheck healthCheck) {
        this.properties = properties;
        this.producerFactory = producerFactory;
        this.consumerFactory = consumerFactory;
        this.healthCheck = healthCheck;
        if (producerFactory instanceof DefaultKafkaProducerFactory) {
            int closeSeconds = (int) Math.max(1, properties.getCloseTimeout().toSeconds());
            ((DefaultKafkaProducerFactory<String, String>) producerFactory).setPhysicalCloseTimeout(closeSeconds);
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == State.CONNECTED;
    }

    /**
     * Check the broker and move to CONNECTED.
     *
     * @throws BrokerUnavailableException if the check fails; the manager is left FAULTED
     */
    public void connect() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Broker connection manager is closed");
            }
            if (state.get() == State.CONNECTED) {
                return;
            }
            State previous = state.getAndSet(State.CONNECTING);
            try {
                healthCheck.verify(properties.getConnectTimeout());
                state.set(State.CONNECTED);
                log.info("Broker connection established: bootstrapServers={}, previousState={}",
                        properties.getBootstrapServers(), previous);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.set(State.FAULTED);
                throw new BrokerUnavailableException("Interrupted while connecting to broker", e);
            } catch (Exception e) {
                state.set(State.FAULTED);
                log.warn("Broker unavailable: bootstrapServers={}, error={}",
                        properties.getBootstrapServers(), e.getMessage());
                throw new BrokerUnavailableException(
                        "Broker unavailable: " + properties.getBootstrapServers(), e);
            }
        }
    }

    public void ensureConnected() {
        if (!isConnected()) {
            connect();
        }
    }

    /**
     * Report a transport failure seen by a channel user. The next channel request reconnects.
     */
    public void markFaulted(Throwable cause) {
        if (state.compareAndSet(State.CONNECTED, State.FAULTED)) {
            log.warn("Broker connection marked faulted: error={}", cause != null ? cause.getMessage() : null);
        }
    }

    private void markConnected(String via) {
        if (closed) {
            return;
        }
        State previous = state.getAndSet(State.CONNECTED);
        if (previous != State.CONNECTED) {
            log.info("Broker connection established: bootstrapServers={}, via={}, previousState={}",
                    properties.getBootstrapServers(), via, previous);
        }
    }

    /**
     * Shared producer channel. Checks the broker first unless already CONNECTED.
     */
    public KafkaTemplate<String, String> producerChannel() {
        ensureConnected();
        KafkaTemplate<String, String> current = template;
        if (current == null) {
            synchronized (lock) {
                if (producerFactory == null) {
                    throw new IllegalStateException("No producer factory configured");
                }
                if (template == null) {
                    template = new KafkaTemplate<>(producerFactory);
                }
                current = template;
            }
        }
        return current;
    }

    /**
     * New consumer channel: a single-threaded listener container subscribed to one topic
     * with manual acknowledgment. It is not started here. The broker is checked but does
     * not need to be reachable; the container's consumer keeps reconnecting until it is,
     * and its first partition assignment moves the manager to CONNECTED.
     */
    public KafkaMessageListenerContainer<String, String> createConsumerChannel(
            String topic, String groupId, Object listener, CommonErrorHandler errorHandler) {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Broker connection manager is closed");
            }
            if (consumerFactory == null) {
                throw new IllegalStateException("No consumer factory configured");
            }
            try {
                ensureConnected();
            } catch (BrokerUnavailableException e) {
                log.warn("Creating consumer channel while broker is unavailable: topic={}, groupId={}, error={}",
                        topic, groupId, e.getMessage());
            }

            ContainerProperties containerProperties = new ContainerProperties(topic);
            containerProperties.setGroupId(groupId);
            containerProperties.setClientId(properties.getClientId() + "-" + groupId);
            containerProperties.setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
            containerProperties.setShutdownTimeout(properties.getCloseTimeout().toMillis());
            containerProperties.setMessageListener(listener);
            containerProperties.setConsumerRebalanceListener(new ConsumerRebalanceListener() {
                @Override
                public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                    if (!partitions.isEmpty()) {
                        markConnected("partitions assigned on " + topic);
                    }
                }

                @Override
                public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                }
            });

            KafkaMessageListenerContainer<String, String> container =
                    new KafkaMessageListenerContainer<>(consumerFactory, containerProperties);
            container.setBeanName(groupId + "-" + topic + "-" + (containers.size() + 1));
            if (errorHandler != null) {
                container.setCommonErrorHandler(errorHandler);
            }
            containers.add(container);

            log.info("Consumer channel created: topic={}, groupId={}", topic, groupId);
            return container;
        }
    }

    /**
     * Stop every channel handed out, close the producer and the health check client.
     * Each step is bounded by the close timeout. Safe to call more than once.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        for (MessageListenerContainer container : containers) {
            try {
                if (container.isRunning()) {
                    container.stop();
                }
            } catch (RuntimeException e) {
                log.warn("Failed to stop consumer channel: container={}", container.getListenerId(), e);
            }
        }
        containers.clear();

        if (producerFactory != null) {
            try {
                producerFactory.reset();
            } catch (RuntimeException e) {
                log.warn("Failed to close producer channel", e);
            }
        }
        template = null;

        try {
            healthCheck.close(properties.getCloseTimeout());
        } catch (RuntimeException e) {
            log.warn("Failed to close broker health check", e);
        }

        state.set(State.DISCONNECTED);
        log.info("Broker connection closed: bootstrapServers={}", properties.getBootstrapServers());
    }

    @Override
    public void destroy() {
        close();
    }

    public boolean isClosed() {
        return closed;
    }
}
