package com.shopflow.shared.events;

/**
 * Raised when an inbound payload cannot be turned back into an event:
 * malformed JSON, a missing identity field or a schema mismatch.
 * Consumers route it to their drop/log path; it is never retried.
 */
public class EventDeserializationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventDeserializationException(String message) {
        super(message);
    }
}
