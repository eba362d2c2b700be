package com.shopflow.order.service;

import com.shopflow.order.config.CheckoutConsumerProperties;
import com.shopflow.order.domain.*;
import com.shopflow.order.domain.CreateOrderCommand.AddressInfo;
import com.shopflow.order.domain.CreateOrderCommand.OrderLine;
import com.shopflow.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.Optional;
import java.util.UUID;

/**
 * Order Creation Pipeline: the only write path for new orders.
 *
 *  1. Validate the command       → OrderValidationException, every failed field
 *  2. Idempotency lookup         → existing order for the same source event is returned, created=false
 *  3. Build Order + OrderItems
 *  4. saveAndFlush               → one transaction; order and items commit together or not at all
 *
 * A unique-key collision on sourceEventId means a concurrent delivery of the same
 * event won; its order is returned. Other store failures become
 * OrderPersistenceException so the consumer can ask for redelivery.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderCreationService {

    private final OrderRepository orderRepository;
    private final OrderCommandValidator validator;
    private final CheckoutConsumerProperties properties;

    /** Synchronous API path; no idempotency key. */
    public OrderCreationResult createOrder(CreateOrderCommand command) {
        return createOrder(command, null);
    }

    /**
     * @param sourceEventId id of the checkout event the command was mapped from; may be null
     */
    public OrderCreationResult createOrder(CreateOrderCommand command, String sourceEventId) {
        validator.validate(command);

        String idempotencyKey = properties.isIdempotencyEnabled() && sourceEventId != null && !sourceEventId.isBlank()
                ? sourceEventId : null;

        if (idempotencyKey != null) {
            Optional<Order> existing = findBySourceEvent(idempotencyKey);
            if (existing.isPresent()) {
                log.info("Order already exists for source event: orderId={}, sourceEventId={}",
                        existing.get().getId(), idempotencyKey);
                return duplicateOf(existing.get());
            }
        }

        Order order = buildOrder(command, idempotencyKey);
        try {
            orderRepository.saveAndFlush(order);
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey != null) {
                Optional<Order> winner = findBySourceEvent(idempotencyKey);
                if (winner.isPresent()) {
                    log.info("Concurrent delivery created the order first: orderId={}, sourceEventId={}",
                            winner.get().getId(), idempotencyKey);
                    return duplicateOf(winner.get());
                }
            }
            throw e;
        } catch (DataAccessException | TransactionException e) {
            throw new OrderPersistenceException("Failed to persist order for customer " + command.getCustomerId(), e);
        }

        log.info("Order created: orderId={}, customerId={}, totalPrice={}, items={}, correlationId={}, sourceEventId={}",
                order.getId(), order.getCustomerId(), order.getTotalPrice(), order.getItems().size(),
                order.getCorrelationId(), idempotencyKey);

        return new OrderCreationResult(order.getId(), order.getCorrelationId(), true);
    }

    private Optional<Order> findBySourceEvent(String sourceEventId) {
        try {
            return orderRepository.findBySourceEventId(sourceEventId);
        } catch (DataAccessException | TransactionException e) {
            throw new OrderPersistenceException("Failed to look up order for source event " + sourceEventId, e);
        }
    }

    private static OrderCreationResult duplicateOf(Order order) {
        return new OrderCreationResult(order.getId(), order.getCorrelationId(), false);
    }

    private static Order buildOrder(CreateOrderCommand command, String sourceEventId) {
        Order order = Order.builder()
                .id(Order.newId())
                .customerId(command.getCustomerId())
                .orderName(command.getOrderName())
                .shippingAddress(toAddress(command.getShippingAddress()))
                .billingAddress(toAddress(command.getBillingAddress()))
                .payment(Payment.builder()
                        .cardName(command.getPayment().getCardName())
                        .cardNumber(command.getPayment().getCardNumber())
                        .expiration(command.getPayment().getExpiration())
                        .cvv(command.getPayment().getCvv())
                        .paymentMethod(command.getPayment().getPaymentMethod())
                        .build())
                .status(OrderStatus.PENDING)
                .correlationId(command.getCorrelationId() != null
                        ? command.getCorrelationId() : UUID.randomUUID().toString())
                .sourceEventId(sourceEventId)
                .build();

        for (OrderLine line : command.getItems()) {
            order.addItem(OrderItem.builder()
                    .productId(line.getProductId())
                    .quantity(line.getQuantity())
                    .price(line.getPrice())
                    .build());
        }
        return order;
    }

    private static Address toAddress(AddressInfo info) {
        return Address.builder()
                .firstName(info.getFirstName())
                .lastName(info.getLastName())
                .emailAddress(info.getEmailAddress())
                .addressLine(info.getAddressLine())
                .country(info.getCountry())
                .state(info.getState())
                .zipCode(info.getZipCode())
                .build();
    }
}
