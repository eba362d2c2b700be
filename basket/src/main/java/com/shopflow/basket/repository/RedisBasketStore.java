package com.shopflow.basket.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.basket.domain.ShoppingCart;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Redis-backed basket store. One JSON document per user.
 *
 * Key format: basket:{userName}
 * No TTL; a basket lives until checkout or explicit delete.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisBasketStore implements BasketStore {

    private static final String KEY_PREFIX = "basket:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<ShoppingCart> getBasket(String userName) {
        String json = redisTemplate.opsForValue().get(buildKey(userName));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ShoppingCart.class));
        } catch (JsonProcessingException e) {
            log.error("Stored basket is unreadable: userName={}, error={}", userName, e.getOriginalMessage());
            throw new BasketStoreException("Failed to deserialize basket: " + userName, e);
        }
    }

    @Override
    public ShoppingCart storeBasket(ShoppingCart cart) {
        try {
            redisTemplate.opsForValue().set(buildKey(cart.getUserName()), objectMapper.writeValueAsString(cart));
            log.debug("Basket stored: userName={}, items={}", cart.getUserName(), cart.getItems().size());
            return cart;
        } catch (JsonProcessingException e) {
            throw new BasketStoreException("Failed to serialize basket: " + cart.getUserName(), e);
        }
    }

    @Override
    public boolean deleteBasket(String userName) {
        return Boolean.TRUE.equals(redisTemplate.delete(buildKey(userName)));
    }

    private String buildKey(String userName) {
        return KEY_PREFIX + userName;
    }

    public static class BasketStoreException extends RuntimeException {
        public BasketStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
