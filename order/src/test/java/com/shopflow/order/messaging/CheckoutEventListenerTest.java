package com.shopflow.order.messaging;

import com.shopflow.shared.events.EventTypes;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckoutEventListenerTest {

    @Mock CheckoutEventDispatcher dispatcher;
    @Mock Acknowledgment acknowledgment;

    CheckoutEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new CheckoutEventListener(dispatcher);
    }

    private static ConsumerRecord<String, String> record(String eventId) {
        ConsumerRecord<String, String> record =
                new ConsumerRecord<>("basket_checkout_queue", 0, 42L, "corr-1", "{}");
        if (eventId != null) {
            record.headers().add(EventTypes.HEADER_EVENT_ID, eventId.getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    @Test
    @DisplayName("processed — acknowledged once")
    void processed_acknowledged() {
        when(dispatcher.dispatch("basket_checkout_queue", "{}")).thenReturn(DispatchOutcome.PROCESSED);

        listener.onMessage(record("evt-1"), acknowledgment);

        verify(acknowledgment, times(1)).acknowledge();
        assertThat(listener.getInFlight()).isEmpty();
    }

    @Test
    @DisplayName("dropped or rejected — still acknowledged so the queue moves on")
    void droppedAndRejected_acknowledged() {
        when(dispatcher.dispatch("basket_checkout_queue", "{}"))
                .thenReturn(DispatchOutcome.DROPPED_MALFORMED, DispatchOutcome.REJECTED, DispatchOutcome.FAILED);

        listener.onMessage(record(null), acknowledgment);
        listener.onMessage(record("evt-2"), acknowledgment);
        listener.onMessage(record("evt-3"), acknowledgment);

        verify(acknowledgment, times(3)).acknowledge();
    }

    @Test
    @DisplayName("retry — not acknowledged, redelivery requested")
    void retry_notAcknowledged() {
        when(dispatcher.dispatch("basket_checkout_queue", "{}")).thenReturn(DispatchOutcome.RETRY);

        assertThatThrownBy(() -> listener.onMessage(record("evt-4"), acknowledgment))
                .isInstanceOfSatisfying(CheckoutRedeliveryException.class,
                        e -> assertThat(e.getMessageId()).isEqualTo("evt-4"));

        verify(acknowledgment, never()).acknowledge();
        assertThat(listener.getInFlight()).isEmpty();
    }

    @Test
    @DisplayName("in-flight id visible during dispatch; falls back to topic-partition@offset")
    void inFlight_duringDispatch() {
        AtomicReference<Optional<String>> seen = new AtomicReference<>();
        when(dispatcher.dispatch("basket_checkout_queue", "{}")).thenAnswer(invocation -> {
            seen.set(listener.getInFlight());
            return DispatchOutcome.PROCESSED;
        });

        listener.onMessage(record(null), acknowledgment);

        assertThat(seen.get()).contains("basket_checkout_queue-0@42");
    }
}
