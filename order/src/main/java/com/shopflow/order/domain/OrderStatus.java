package com.shopflow.order.domain;

public enum OrderStatus {
    DRAFT,
    PENDING,
    COMPLETED,
    CANCELLED
}
