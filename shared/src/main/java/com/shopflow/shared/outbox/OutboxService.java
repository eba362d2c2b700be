package com.shopflow.shared.outbox;

import com.shopflow.shared.events.DomainEvent;
import com.shopflow.shared.events.EventSerializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Appends an event to the outbox. Joins the caller's transaction when there is one,
 * so the row commits or rolls back with the state change that raised the event.
 *
 * <pre>
 * {@literal @}Transactional
 * public CheckoutReceipt stage(ShoppingCart cart, CheckoutDetails details) {
 *     BasketCheckoutEvent event = ...;
 *     outboxService.append(cart.getUserName(), "Basket", TOPIC_BASKET_CHECKOUT, event);
 *     return ...;
 * }
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository outboxRepository;
    private final EventSerializer serializer;

    /**
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    @Transactional
    public OutboxRecord append(String aggregateId, String aggregateType, String topic, DomainEvent event) {
        OutboxRecord record = OutboxRecord.stage(event.getId(), aggregateType, aggregateId, event.getType(),
                topic, event.getCorrelationId(), serializer.serialize(event), Instant.now());

        OutboxRecord saved = outboxRepository.save(record);

        log.debug("Outbox record appended: eventId={}, type={}, aggregateId={}",
                event.getId(), event.getType(), aggregateId);
        return saved;
    }
}
