package com.shopflow.order.messaging;

import com.shopflow.order.config.CheckoutConsumerProperties;
import com.shopflow.shared.kafka.BrokerConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Checkout Event Subscriber
 *
 * Subscribes the ordering service to the checkout queue for the lifetime of the
 * application context.
 *
 *   IDLE ──start()──▶ SUBSCRIBED ⇄ DISPATCHING(messageId)
 *     ▲                   │
 *     └─────stop()────────┘
 *
 * One consumer thread per instance, so messages of a partition are handled one at a
 * time. Starting while the broker is down succeeds; the consumer keeps polling and
 * picks messages up once the broker is reachable.
 */
@Slf4j
@Component
public class CheckoutEventSubscriber implements SmartLifecycle {

    public enum State {
        IDLE,
        SUBSCRIBED,
        DISPATCHING
    }

    private final BrokerConnectionManager connectionManager;
    private final CheckoutEventListener listener;
    private final CommonErrorHandler errorHandler;
    private final CheckoutConsumerProperties properties;

    private volatile KafkaMessageListenerContainer<String, String> container;

    public CheckoutEventSubscriber(BrokerConnectionManager connectionManager,
                                   CheckoutEventListener listener,
                                   CommonErrorHandler checkoutErrorHandler,
                                   CheckoutConsumerProperties properties) {
        this.connectionManager = connectionManager;
        this.listener = listener;
        this.errorHandler = checkoutErrorHandler;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (container != null) {
            return;
        }
        KafkaMessageListenerContainer<String, String> channel = connectionManager.createConsumerChannel(
                properties.getTopic(), properties.getConsumerGroup(), listener, errorHandler);
        channel.start();
        container = channel;
        log.info("Checkout subscriber started: topic={}, groupId={}",
                properties.getTopic(), properties.getConsumerGroup());
    }

    @Override
    public synchronized void stop() {
        KafkaMessageListenerContainer<String, String> channel = container;
        if (channel == null) {
            return;
        }
        container = null;

        CountDownLatch stopped = new CountDownLatch(1);
        channel.stop(stopped::countDown);
        try {
            if (!stopped.await(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Checkout subscriber did not stop within {}: inFlight={}",
                        properties.getShutdownTimeout(), listener.getInFlight().orElse(null));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping checkout subscriber");
        }
        log.info("Checkout subscriber stopped: topic={}", properties.getTopic());
    }

    @Override
    public boolean isRunning() {
        return container != null;
    }

    public State getState() {
        if (container == null) {
            return State.IDLE;
        }
        return listener.getInFlight().isPresent() ? State.DISPATCHING : State.SUBSCRIBED;
    }

    public Optional<String> getDispatchingMessageId() {
        return listener.getInFlight();
    }
}
