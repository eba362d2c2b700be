package com.shopflow.basket.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shipping and payment details supplied by the caller at checkout.
 * Field rules are enforced by ordering when the order is created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutDetails {

    /** Optional; ordering falls back to the user name. */
    private String buyerId;

    private String firstName;
    private String lastName;
    private String emailAddress;
    private String addressLine;
    private String country;
    private String state;
    private String zipCode;

    private String cardName;
    private String cardNumber;
    private String expiration;
    private String cvv;
    private int paymentMethod;
}
