package com.shopflow.order.config;

import com.shopflow.shared.events.EventTypes;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "shopflow.checkout")
public class CheckoutConsumerProperties {

    private String topic = EventTypes.TOPIC_BASKET_CHECKOUT;

    /** Competing consumers: every ordering instance joins the same group. */
    private String consumerGroup = "ordering-service";

    /**
     * Key orders on the checkout event id so redelivery cannot create a second order.
     * Disabling reproduces at-least-once duplicates.
     */
    private boolean idempotencyEnabled = true;

    /** Upper bound for letting the in-flight message finish on stop. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
