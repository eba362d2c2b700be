package com.shopflow.basket.config;

import com.shopflow.shared.events.EventTypes;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "shopflow.checkout")
public class CheckoutProperties {

    public enum PublishMode {
        /** Delete the basket, then publish and wait for the broker ack. */
        DIRECT,
        /** Stage the event in the outbox table; the relay publishes it. */
        OUTBOX
    }

    private String topic = EventTypes.TOPIC_BASKET_CHECKOUT;

    private PublishMode publishMode = PublishMode.DIRECT;
}
