package com.shopflow.basket.service;

import com.shopflow.basket.config.CheckoutProperties;
import com.shopflow.basket.domain.BasketNotFoundException;
import com.shopflow.basket.domain.CheckoutPublishException;
import com.shopflow.basket.domain.ShoppingCart;
import com.shopflow.basket.domain.ShoppingCartItem;
import com.shopflow.basket.repository.BasketStore;
import com.shopflow.shared.events.Events.BasketCheckoutEvent;
import com.shopflow.shared.events.Events.CheckoutItem;
import com.shopflow.shared.kafka.EventPublisher;
import com.shopflow.shared.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;

/**
 * Checkout: turns a basket into exactly one basket.checkout event.
 *
 * DIRECT mode (delete-then-publish):
 *   1. Load basket            → BasketNotFoundException if absent, nothing published
 *   2. Delete basket
 *   3. Publish and wait       → CheckoutPublishException if the broker does not ack
 *   A failure in step 3 loses the checkout; the error log carries user and total.
 *
 * OUTBOX mode:
 *   1. Load basket
 *   2. Delete basket          → BasketNotFoundException if a concurrent checkout won
 *   3. Append event to the outbox (committed)
 *   The relay publishes later. A failure in step 3 puts the basket back.
 *
 * In both modes the delete decides which of two concurrent checkouts emits the event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    static final String AGGREGATE_TYPE = "Basket";

    private final BasketStore basketStore;
    private final EventPublisher eventPublisher;
    private final OutboxService outboxService;
    private final CheckoutProperties properties;

    public CheckoutReceipt checkout(String userName, CheckoutDetails details) {
        ShoppingCart basket = basketStore.getBasket(userName)
                .orElseThrow(() -> new BasketNotFoundException(userName));

        return properties.getPublishMode() == CheckoutProperties.PublishMode.OUTBOX
                ? checkoutViaOutbox(basket, details)
                : checkoutDirect(basket, details);
    }

    private CheckoutReceipt checkoutDirect(ShoppingCart basket, CheckoutDetails details) {
        String userName = basket.getUserName();
        if (!basketStore.deleteBasket(userName)) {
            // Removed concurrently, e.g. a double-submitted checkout
            throw new BasketNotFoundException(userName);
        }

        BasketCheckoutEvent event = toEvent(basket, details);
        try {
            eventPublisher.publishAndWait(properties.getTopic(), event);
        } catch (EventPublisher.EventPublishException e) {
            log.error("Checkout publish failed after basket deletion: userName={}, totalPrice={}, items={}, eventId={}, error={}",
                    userName, basket.getTotalPrice(), basket.getItems().size(), event.getId(), e.getMessage(), e);
            throw new CheckoutPublishException(userName, basket.getTotalPrice(), e);
        }

        log.info("Checkout accepted: userName={}, eventId={}, correlationId={}, totalPrice={}, mode=DIRECT",
                userName, event.getId(), event.getCorrelationId(), event.getTotalPrice());
        return receipt(event);
    }

    private CheckoutReceipt checkoutViaOutbox(ShoppingCart basket, CheckoutDetails details) {
        String userName = basket.getUserName();
        if (!basketStore.deleteBasket(userName)) {
            throw new BasketNotFoundException(userName);
        }

        BasketCheckoutEvent event = toEvent(basket, details);
        try {
            outboxService.append(userName, AGGREGATE_TYPE, properties.getTopic(), event);
        } catch (DataAccessException | TransactionException e) {
            log.error("Checkout could not be staged: userName={}, totalPrice={}, eventId={}, error={}",
                    userName, basket.getTotalPrice(), event.getId(), e.getMessage(), e);
            restore(basket);
            throw new CheckoutPublishException(userName, basket.getTotalPrice(), e);
        }

        log.info("Checkout accepted: userName={}, eventId={}, correlationId={}, totalPrice={}, mode=OUTBOX",
                userName, event.getId(), event.getCorrelationId(), event.getTotalPrice());
        return receipt(event);
    }

    private void restore(ShoppingCart basket) {
        try {
            basketStore.storeBasket(basket);
            log.info("Basket restored after failed checkout: userName={}", basket.getUserName());
        } catch (RuntimeException e) {
            log.error("Failed to restore basket after failed checkout: userName={}, totalPrice={}, items={}",
                    basket.getUserName(), basket.getTotalPrice(), basket.getItems().size(), e);
        }
    }

    static BasketCheckoutEvent toEvent(ShoppingCart basket, CheckoutDetails details) {
        List<CheckoutItem> items = basket.getItems().stream()
                .map(CheckoutService::toCheckoutItem)
                .toList();

        return BasketCheckoutEvent.builder()
                .userName(basket.getUserName())
                .buyerId(details.getBuyerId())
                .totalPrice(basket.getTotalPrice())
                .firstName(details.getFirstName())
                .lastName(details.getLastName())
                .emailAddress(details.getEmailAddress())
                .addressLine(details.getAddressLine())
                .country(details.getCountry())
                .state(details.getState())
                .zipCode(details.getZipCode())
                .cardName(details.getCardName())
                .cardNumber(details.getCardNumber())
                .expiration(details.getExpiration())
                .cvv(details.getCvv())
                .paymentMethod(details.getPaymentMethod())
                .items(items)
                .build();
    }

    private static CheckoutItem toCheckoutItem(ShoppingCartItem item) {
        return new CheckoutItem(item.getProductId(), item.getQuantity(), item.getPrice(), item.getColor());
    }

    private static CheckoutReceipt receipt(BasketCheckoutEvent event) {
        return new CheckoutReceipt(event.getId(), event.getCorrelationId(), event.getTotalPrice());
    }
}
