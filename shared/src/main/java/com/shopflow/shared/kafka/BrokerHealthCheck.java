package com.shopflow.shared.kafka;

import java.time.Duration;

/**
 * Reachability check used by {@link BrokerConnectionManager} before it hands out
 * a producer channel. Implementations must return within the given timeout.
 */
@FunctionalInterface
public interface BrokerHealthCheck {

    void verify(Duration timeout) throws Exception;

    default void close(Duration timeout) {
    }
}
