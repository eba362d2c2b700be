package com.shopflow.order.messaging;

import com.shopflow.shared.events.EventTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manual-ack bridge between the listener container and the dispatcher.
 *
 * Offsets are committed for every outcome except RETRY. RETRY throws, the
 * container's error handler re-seeks and the same message comes back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckoutEventListener implements AcknowledgingMessageListener<String, String> {

    private final CheckoutEventDispatcher dispatcher;

    private final AtomicReference<String> inFlight = new AtomicReference<>();

    @Override
    public void onMessage(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        String messageId = messageId(record);
        inFlight.set(messageId);
        try {
            DispatchOutcome outcome = dispatcher.dispatch(record.topic(), record.value());
            if (!outcome.shouldAcknowledge()) {
                throw new CheckoutRedeliveryException(messageId);
            }
            acknowledgment.acknowledge();
            log.debug("Checkout message acknowledged: messageId={}, outcome={}, partition={}, offset={}",
                    messageId, outcome, record.partition(), record.offset());
        } finally {
            inFlight.set(null);
        }
    }

    /** Id of the message being dispatched right now, if any. */
    public Optional<String> getInFlight() {
        return Optional.ofNullable(inFlight.get());
    }

    private static String messageId(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(EventTypes.HEADER_EVENT_ID);
        if (header != null && header.value() != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
