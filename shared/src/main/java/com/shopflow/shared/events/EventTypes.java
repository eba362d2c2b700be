package com.shopflow.shared.events;

/**
 * Canonical event type constants.
 * All services MUST use these constants — never hardcode strings.
 * Changing a type here is a breaking change requiring consumer updates.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Basket Domain ─────────────────────────────────────────────────────────
    public static final String BASKET_CHECKOUT = "basket.checkout";

    // ── Sources ───────────────────────────────────────────────────────────────
    public static final String SOURCE_BASKET_SERVICE = "/services/basket-service";
    public static final String SOURCE_OUTBOX_RELAY   = "/services/outbox-relay";

    // ── Topics ────────────────────────────────────────────────────────────────
    // Publish-direct-to-queue: one well-known topic, no exchange fan-out.
    public static final String TOPIC_BASKET_CHECKOUT = "basket_checkout_queue";

    // ── Headers ───────────────────────────────────────────────────────────────
    public static final String HEADER_EVENT_ID       = "event-id";
    public static final String HEADER_EVENT_TYPE     = "event-type";
    public static final String HEADER_EVENT_VERSION  = "event-version";
    public static final String HEADER_CORRELATION_ID = "correlation-id";
    public static final String HEADER_CAUSATION_ID   = "causation-id";
}
