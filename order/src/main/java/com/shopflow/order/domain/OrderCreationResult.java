package com.shopflow.order.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class OrderCreationResult {
    private final String orderId;
    private final String correlationId;
    /** false when an order for the same source event already existed */
    private final boolean created;
}
