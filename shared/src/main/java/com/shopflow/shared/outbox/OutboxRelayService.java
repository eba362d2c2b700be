package com.shopflow.shared.outbox;

import com.shopflow.shared.kafka.BrokerProperties;
import com.shopflow.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Outbox Relay: polls the outbox table and publishes pending rows.
 *
 * Runs one second after the previous poll completes, up to 50 due rows per poll.
 * The stored payload is sent as-is so the event id and timestamp do not change
 * between the write and the publish. A failed row is rescheduled with a capped
 * backoff and retried until the broker takes it; rows past the attention threshold
 * are logged at error level on every failure.
 */
@Slf4j
@Service
public class OutboxRelayService {

    static final int BATCH_SIZE = 50;

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final BrokerProperties brokerProperties;
    private final Counter relayedCounter;
    private final Counter relayErrorCounter;

    public OutboxRelayService(OutboxRepository outboxRepository,
                              EventPublisher eventPublisher,
                              BrokerProperties brokerProperties,
                              MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.brokerProperties = brokerProperties;
        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to the broker")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
    }

    /**
     * @return number of rows published in this pass
     */
    @Scheduled(fixedDelayString = "${shopflow.outbox.relay-interval:1000}")
    @Transactional
    public int relay() {
        List<OutboxRecord> records = outboxRepository.findDueForRelay(Instant.now(), BATCH_SIZE);
        if (records.isEmpty()) {
            return 0;
        }

        log.debug("Outbox relay: processing {} records", records.size());

        int published = 0;
        for (OutboxRecord record : records) {
            try {
                publishRecord(record);
                record.markPublished(Instant.now());
                relayedCounter.increment();
                published++;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                record.scheduleRetry("Interrupted", Instant.now());
                relayErrorCounter.increment();
                break;
            } catch (ExecutionException | TimeoutException | RuntimeException ex) {
                Throwable cause = ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex;
                Duration delay = record.scheduleRetry(cause.getMessage(), Instant.now());
                relayErrorCounter.increment();
                if (record.needsAttention()) {
                    log.error("Outbox record still undelivered: eventId={}, aggregateId={}, attempts={}, retryIn={}, error={}",
                            record.getEventId(), record.getAggregateId(), record.getAttempts(), delay, cause.getMessage());
                } else {
                    log.warn("Failed to relay outbox record: eventId={}, attempts={}, retryIn={}, error={}",
                            record.getEventId(), record.getAttempts(), delay, cause.getMessage());
                }
            }
        }

        outboxRepository.saveAll(records);
        return published;
    }

    private void publishRecord(OutboxRecord record)
            throws InterruptedException, ExecutionException, TimeoutException {
        eventPublisher.publishRaw(record.getTopic(), record.getPartitionKey(),
                        record.getEventId(), record.getEventType(), record.getPayload())
                .get(brokerProperties.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }
}
