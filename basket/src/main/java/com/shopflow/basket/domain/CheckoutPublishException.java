package com.shopflow.basket.domain;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * The checkout event could not be handed to the broker.
 *
 * In DIRECT mode the basket is already gone when this is thrown; the user name
 * and total are carried for manual reconciliation.
 */
@Getter
public class CheckoutPublishException extends RuntimeException {

    private final String userName;
    private final BigDecimal totalPrice;

    public CheckoutPublishException(String userName, BigDecimal totalPrice, Throwable cause) {
        super("Checkout could not be published for user " + userName, cause);
        this.userName = userName;
        this.totalPrice = totalPrice;
    }
}
