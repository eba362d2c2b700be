package com.shopflow.shared.outbox;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;

/**
 * Checkout event staged for delivery.
 *
 * Written in the checkout's transaction, then handed to the broker by
 * {@link OutboxRelayService}. The row id is the event id, so the relayed message keeps
 * the identity the ordering service keys idempotency on.
 *
 * Delivery schedule: a PENDING row is due once {@code nextAttemptAt} has passed. Every
 * failed send pushes it back by 5s, 10s, 20s ... capped at 5 minutes. A row is never
 * abandoned; after {@value #ATTENTION_AFTER_ATTEMPTS} failures it is flagged as needing
 * attention and the relay logs it at error level, but it stays due.
 */
@Entity
@Table(name = "checkout_outbox", indexes = {
    @Index(name = "idx_checkout_outbox_due", columnList = "status, next_attempt_at"),
    @Index(name = "idx_checkout_outbox_basket", columnList = "aggregate_id")
})
@Getter
@ToString(exclude = "payload")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxRecord {

    public enum Status {
        PENDING,
        PUBLISHED
    }

    public static final int ATTENTION_AFTER_ATTEMPTS = 5;

    static final Duration FIRST_RETRY_DELAY = Duration.ofSeconds(5);
    static final Duration MAX_RETRY_DELAY = Duration.ofMinutes(5);

    @Id
    @Column(name = "event_id", length = 36)
    private String eventId;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "topic", nullable = false, length = 200)
    private String topic;

    @Column(name = "partition_key", length = 100)
    private String partitionKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "staged_at", nullable = false, updatable = false)
    private Instant stagedAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    private OutboxRecord(String eventId, String aggregateType, String aggregateId, String eventType,
                         String topic, String partitionKey, String payload, Instant stagedAt) {
        this.eventId = eventId;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.eventType = eventType;
        this.topic = topic;
        this.partitionKey = partitionKey;
        this.payload = payload;
        this.status = Status.PENDING;
        this.attempts = 0;
        this.nextAttemptAt = stagedAt;
        this.stagedAt = stagedAt;
    }

    /** New row, due immediately. */
    public static OutboxRecord stage(String eventId, String aggregateType, String aggregateId, String eventType,
                                     String topic, String partitionKey, String payload, Instant now) {
        return new OutboxRecord(eventId, aggregateType, aggregateId, eventType, topic, partitionKey, payload, now);
    }

    public boolean isPublished() {
        return status == Status.PUBLISHED;
    }

    public boolean needsAttention() {
        return status == Status.PENDING && attempts >= ATTENTION_AFTER_ATTEMPTS;
    }

    public void markPublished(Instant now) {
        this.status = Status.PUBLISHED;
        this.attempts++;
        this.lastAttemptAt = now;
        this.publishedAt = now;
        this.lastError = null;
    }

    /**
     * Record a failed send and push the row back.
     *
     * @return delay until the row is due again
     */
    public Duration scheduleRetry(String error, Instant now) {
        this.attempts++;
        this.lastAttemptAt = now;
        this.lastError = error;
        Duration delay = retryDelay(attempts);
        this.nextAttemptAt = now.plus(delay);
        return delay;
    }

    /** Delay after the given number of failed attempts: 5s doubling, capped at 5 minutes. */
    static Duration retryDelay(int failedAttempts) {
        int doublings = Math.min(Math.max(failedAttempts - 1, 0), 16);
        Duration delay = FIRST_RETRY_DELAY.multipliedBy(1L << doublings);
        return delay.compareTo(MAX_RETRY_DELAY) > 0 ? MAX_RETRY_DELAY : delay;
    }
}
