package com.shopflow.basket.domain;

import lombok.Getter;

@Getter
public class BasketNotFoundException extends RuntimeException {

    private final String userName;

    public BasketNotFoundException(String userName) {
        super("Basket not found: " + userName);
        this.userName = userName;
    }
}
