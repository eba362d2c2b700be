package com.shopflow.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Ordering Service — Entry Point
 *
 * Consumes basket.checkout events and creates orders through the same pipeline
 * as the REST API.
 *
 * Port: 8081 (see application.yml)
 */
@SpringBootApplication
@ComponentScan(basePackages = {"com.shopflow.order", "com.shopflow.shared.events"})
public class OrderServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
