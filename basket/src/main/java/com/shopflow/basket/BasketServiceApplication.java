package com.shopflow.basket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Basket Service — Entry Point
 *
 * Holds shopping carts in Redis and turns a checkout into a basket.checkout event.
 * The outbox table lives in this service's Postgres schema.
 *
 * Port: 8080 (see application.yml)
 */
@SpringBootApplication
@ComponentScan(basePackages = {"com.shopflow.basket", "com.shopflow.shared.events", "com.shopflow.shared.outbox"})
@EntityScan(basePackages = "com.shopflow.shared.outbox")
@EnableJpaRepositories(basePackages = "com.shopflow.shared.outbox")
public class BasketServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BasketServiceApplication.class, args);
    }
}
