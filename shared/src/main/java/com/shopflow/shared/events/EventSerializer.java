package com.shopflow.shared.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Wire codec for integration events (JSON, UTF-8).
 *
 * Identity fields travel with the payload and are restored as-is on the way in.
 * Amounts are BigDecimal end to end; the configured ObjectMapper writes them in
 * plain notation so the text on the wire is the decimal the publisher computed.
 */
@Component
@RequiredArgsConstructor
public class EventSerializer {

    private final ObjectMapper objectMapper;

    /**
     * Mapper settings every service registers as its ObjectMapper bean:
     * ISO-8601 instants, plain-notation decimals, and decimals read as BigDecimal.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        return mapper;
    }

    public String serialize(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event to JSON: " + event.getType(), e);
        }
    }

    public byte[] serializeToBytes(DomainEvent event) {
        return serialize(event).getBytes(StandardCharsets.UTF_8);
    }

    public <T extends DomainEvent> T deserialize(String payload, Class<T> eventClass) {
        if (payload == null || payload.isBlank()) {
            throw new EventDeserializationException("Empty payload for " + eventClass.getSimpleName());
        }
        try {
            T event = objectMapper.readValue(payload, eventClass);
            if (event == null) {
                throw new EventDeserializationException("Null payload for " + eventClass.getSimpleName());
            }
            return event;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventDeserializationException(
                    "Cannot deserialize " + eventClass.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    public <T extends DomainEvent> T deserialize(byte[] payload, Class<T> eventClass) {
        if (payload == null) {
            throw new EventDeserializationException("Empty payload for " + eventClass.getSimpleName());
        }
        return deserialize(new String(payload, StandardCharsets.UTF_8), eventClass);
    }
}
