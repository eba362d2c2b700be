package com.shopflow.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Base CloudEvent following the CloudEvents specification v1.0.
 * https://cloudevents.io/
 *
 * All integration events extend this class. Every event carries:
 *  - id:            Globally unique event identifier (UUID v4)
 *  - type:          Hierarchical dot-notation name, e.g. "basket.checkout"
 *  - source:        Originating service URI, e.g. "/services/basket-service"
 *  - time:          ISO 8601 timestamp of when the event occurred
 *  - correlationId: Ties the checkout request to the order it produces
 *  - causationId:   The event that caused this event (parent event ID)
 *  - version:       Schema version for forward compatibility
 *
 * id and time are assigned once, when the event is first raised. The
 * rehydrating constructor takes them verbatim so a consumer sees the
 * publisher's identity, never a fresh one.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class DomainEvent {

    private final String id;
    private final String type;
    private final String source;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    private final String correlationId;
    private final String causationId;
    private final int version;

    protected DomainEvent(String type, String source, String correlationId, String causationId, int version) {
        this(UUID.randomUUID().toString(), type, source, Instant.now(),
                correlationId != null ? correlationId : UUID.randomUUID().toString(),
                causationId, version);
    }

    protected DomainEvent(String type, String source, String correlationId) {
        this(type, source, correlationId, null, 1);
    }

    protected DomainEvent(String id, String type, String source, Instant time,
                          String correlationId, String causationId, int version) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Event id is required");
        }
        this.id = id;
        this.type = type;
        this.source = source;
        this.time = time;
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.version = version;
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public String getSpecversion() {
        return "1.0";
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public String getDatacontenttype() {
        return "application/json";
    }
}
