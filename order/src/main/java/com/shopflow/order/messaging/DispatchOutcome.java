package com.shopflow.order.messaging;

/**
 * What the dispatcher did with one delivered message.
 * Every outcome except RETRY acknowledges the message.
 */
public enum DispatchOutcome {
    /** Routing key is not the checkout queue */
    IGNORED,
    /** Payload did not deserialize into a checkout event */
    DROPPED_MALFORMED,
    /** Mapped command failed validation */
    REJECTED,
    /** Order store unavailable; redeliver */
    RETRY,
    /** Unexpected failure; logged with the event id */
    FAILED,
    PROCESSED,
    /** An order for this event id already exists */
    DUPLICATE;

    public boolean shouldAcknowledge() {
        return this != RETRY;
    }
}
