package com.shopflow.order.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Order aggregate root.
 *
 * Created only by {@code OrderCreationService}, from the REST command or from a
 * mapped checkout event. Items are owned by the order: they are persisted and
 * removed with it. The total is derived from the items, never stored.
 *
 * sourceEventId is the idempotency key of an event-created order (unique, null for
 * API-created orders and when idempotency is disabled).
 */
@Entity
@Table(name = "orders",
    indexes = {
        @Index(name = "idx_orders_customer_id", columnList = "customer_id"),
        @Index(name = "idx_orders_correlation_id", columnList = "correlation_id"),
        @Index(name = "idx_orders_created_at", columnList = "created_at")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_orders_source_event_id", columnNames = "source_event_id")
    })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(name = "id", length = 50)
    private String id;

    @Column(name = "customer_id", nullable = false, length = 100)
    private String customerId;

    @Column(name = "order_name", nullable = false, length = 100)
    private String orderName;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "firstName", column = @Column(name = "shipping_first_name", length = 100)),
        @AttributeOverride(name = "lastName", column = @Column(name = "shipping_last_name", length = 100)),
        @AttributeOverride(name = "emailAddress", column = @Column(name = "shipping_email_address", length = 200)),
        @AttributeOverride(name = "addressLine", column = @Column(name = "shipping_address_line", length = 300)),
        @AttributeOverride(name = "country", column = @Column(name = "shipping_country", length = 100)),
        @AttributeOverride(name = "state", column = @Column(name = "shipping_state", length = 100)),
        @AttributeOverride(name = "zipCode", column = @Column(name = "shipping_zip_code", length = 20))
    })
    private Address shippingAddress;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "firstName", column = @Column(name = "billing_first_name", length = 100)),
        @AttributeOverride(name = "lastName", column = @Column(name = "billing_last_name", length = 100)),
        @AttributeOverride(name = "emailAddress", column = @Column(name = "billing_email_address", length = 200)),
        @AttributeOverride(name = "addressLine", column = @Column(name = "billing_address_line", length = 300)),
        @AttributeOverride(name = "country", column = @Column(name = "billing_country", length = 100)),
        @AttributeOverride(name = "state", column = @Column(name = "billing_state", length = 100)),
        @AttributeOverride(name = "zipCode", column = @Column(name = "billing_zip_code", length = 20))
    })
    private Address billingAddress;

    @Embedded
    private Payment payment;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "correlation_id", nullable = false, length = 36)
    private String correlationId;

    @Column(name = "source_event_id", length = 36)
    private String sourceEventId;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    /** Optimistic locking */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static String newId() {
        return "ord_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    public BigDecimal getTotalPrice() {
        return items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
