package com.shopflow.order.messaging;

import lombok.Getter;

/**
 * Thrown from the listener to leave a message unacknowledged; the container's error
 * handler seeks back to it and redelivers after a backoff.
 */
@Getter
public class CheckoutRedeliveryException extends RuntimeException {

    private final String messageId;

    public CheckoutRedeliveryException(String messageId) {
        super("Checkout message left unacknowledged for redelivery: " + messageId);
        this.messageId = messageId;
    }
}
