package com.shopflow.basket.repository;

import com.shopflow.basket.domain.ShoppingCart;

import java.util.Optional;

/**
 * Key-value store of baskets, one per user name.
 */
public interface BasketStore {

    Optional<ShoppingCart> getBasket(String userName);

    ShoppingCart storeBasket(ShoppingCart cart);

    /**
     * @return true if a basket existed and was removed
     */
    boolean deleteBasket(String userName);
}
