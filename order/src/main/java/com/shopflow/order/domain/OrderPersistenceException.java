package com.shopflow.order.domain;

/**
 * The order store could not be reached or did not commit. Retryable.
 */
public class OrderPersistenceException extends RuntimeException {
    public OrderPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
