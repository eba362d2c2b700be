package com.shopflow.basket.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@AllArgsConstructor
public class CheckoutReceipt {
    private final String eventId;
    private final String correlationId;
    private final BigDecimal totalPrice;
}
