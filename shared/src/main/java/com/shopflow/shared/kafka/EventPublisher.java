package com.shopflow.shared.kafka;

import com.shopflow.shared.events.DomainEvent;
import com.shopflow.shared.events.EventSerializer;
import com.shopflow.shared.events.EventTypes;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checkout-platform Kafka producer.
 *
 * Wraps the connection manager's shared producer channel with:
 *  - Event serialization through {@link EventSerializer}
 *  - Envelope metadata propagated as Kafka headers
 *  - Micrometer metrics (publish rate, latency, error rate)
 *  - Structured logging with event metadata
 *
 * A transport failure marks the connection faulted so the next publish checks
 * the broker again instead of queueing behind a dead producer.
 */
@Slf4j
public class EventPublisher {

    private final BrokerConnectionManager connectionManager;
    private final EventSerializer serializer;
    private final BrokerProperties properties;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(BrokerConnectionManager connectionManager,
                          EventSerializer serializer,
                          BrokerProperties properties,
                          MeterRegistry meterRegistry) {
        this.connectionManager = connectionManager;
        this.serializer = serializer;
        this.properties = properties;
        this.publishSuccessCounter = Counter.builder("checkout.messages.published")
                .tag("status", "success")
                .description("Total messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("checkout.messages.published")
                .tag("status", "error")
                .description("Total message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("checkout.publish.duration")
                .description("Time to publish a message to the broker")
                .register(meterRegistry);
    }

    /**
     * Publish a domain event keyed by its correlation id.
     *
     * @return future completed when the broker acknowledges, or failed with the transport error
     */
    public CompletableFuture<SendResult<String, String>> publish(String topic, DomainEvent event) {
        return publish(topic, event, event.getCorrelationId());
    }

    public CompletableFuture<SendResult<String, String>> publish(String topic, DomainEvent event, String partitionKey) {
        String payload;
        try {
            payload = serializer.serialize(event);
        } catch (IllegalArgumentException e) {
            log.error("Failed to serialize event: eventId={}, type={}", event.getId(), event.getType(), e);
            publishErrorCounter.increment();
            return CompletableFuture.failedFuture(e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, payload);
        addHeader(record, EventTypes.HEADER_EVENT_TYPE, event.getType());
        addHeader(record, EventTypes.HEADER_EVENT_ID, event.getId());
        addHeader(record, EventTypes.HEADER_EVENT_VERSION, String.valueOf(event.getVersion()));
        addHeader(record, EventTypes.HEADER_CORRELATION_ID, event.getCorrelationId());
        addHeader(record, EventTypes.HEADER_CAUSATION_ID, event.getCausationId());

        return send(record, event.getId(), event.getType());
    }

    /**
     * Publish an already-serialized payload. Used by the outbox relay so the stored
     * event keeps the id it was written with.
     */
    public CompletableFuture<SendResult<String, String>> publishRaw(String topic, String partitionKey,
                                                                    String eventId, String eventType,
                                                                    String payload) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, partitionKey, payload);
        addHeader(record, EventTypes.HEADER_EVENT_TYPE, eventType);
        addHeader(record, EventTypes.HEADER_EVENT_ID, eventId);
        addHeader(record, EventTypes.HEADER_CORRELATION_ID, partitionKey);
        return send(record, eventId, eventType);
    }

    /**
     * Synchronous publish. Blocks until the broker acknowledges or the send timeout elapses.
     *
     * @throws EventPublishException on broker unavailability, transport failure or timeout
     */
    public void publishAndWait(String topic, DomainEvent event) {
        try {
            publish(topic, event).get(properties.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing event: " + event.getType(), e);
        } catch (ExecutionException e) {
            throw new EventPublishException("Failed to publish event synchronously: " + event.getType(), e.getCause());
        } catch (TimeoutException e) {
            connectionManager.markFaulted(e);
            throw new EventPublishException("Timed out publishing event: " + event.getType(), e);
        }
    }

    private CompletableFuture<SendResult<String, String>> send(ProducerRecord<String, String> record,
                                                               String eventId, String eventType) {
        Timer.Sample sample = Timer.start();
        CompletableFuture<SendResult<String, String>> future;
        try {
            future = connectionManager.producerChannel().send(record);
        } catch (RuntimeException e) {
            sample.stop(publishTimer);
            publishErrorCounter.increment();
            connectionManager.markFaulted(e);
            log.error("Failed to publish event: topic={}, eventId={}, type={}, error={}",
                    record.topic(), eventId, eventType, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((result, ex) -> {
            sample.stop(publishTimer);
            if (ex == null) {
                publishSuccessCounter.increment();
                log.debug("Event published: topic={}, eventId={}, type={}, partition={}, offset={}",
                        record.topic(), eventId, eventType,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                publishErrorCounter.increment();
                connectionManager.markFaulted(ex);
                log.error("Failed to publish event: topic={}, eventId={}, type={}, error={}",
                        record.topic(), eventId, eventType, ex.getMessage(), ex);
            }
        });
    }

    private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        if (value != null) {
            record.headers().add(new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8)));
        }
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
