package com.shopflow.shared.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "shopflow.broker")
public class BrokerProperties {

    /** Overridden by spring.kafka.bootstrap-servers in the service configs. */
    private String bootstrapServers = "localhost:9092";

    private String clientId = "shopflow";

    /** Upper bound for a single reachability check. */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Upper bound for broker acknowledgement of a synchronous publish. */
    private Duration sendTimeout = Duration.ofSeconds(10);

    /** Upper bound for stopping consumers and closing the producer on shutdown. */
    private Duration closeTimeout = Duration.ofSeconds(10);
}
