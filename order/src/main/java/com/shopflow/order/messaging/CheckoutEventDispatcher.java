package com.shopflow.order.messaging;

import com.shopflow.order.config.CheckoutConsumerProperties;
import com.shopflow.order.domain.CreateOrderCommand;
import com.shopflow.order.domain.OrderCreationResult;
import com.shopflow.order.domain.OrderPersistenceException;
import com.shopflow.order.domain.OrderValidationException;
import com.shopflow.order.service.OrderCreationService;
import com.shopflow.shared.events.EventDeserializationException;
import com.shopflow.shared.events.EventSerializer;
import com.shopflow.shared.events.Events.BasketCheckoutEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Checkout Event Dispatcher
 *
 * One delivered message in, one {@link DispatchOutcome} out. Never throws, so a bad
 * message cannot stop the consumer loop:
 *  1. Routing key check            → IGNORED
 *  2. Deserialize                  → DROPPED_MALFORMED (logged, not dead-lettered)
 *  3. Map to CreateOrderCommand
 *  4. OrderCreationService         → PROCESSED | DUPLICATE | REJECTED | RETRY | FAILED
 */
@Slf4j
@Component
public class CheckoutEventDispatcher {

    private final EventSerializer serializer;
    private final CheckoutEventMapper mapper;
    private final OrderCreationService orderCreationService;
    private final CheckoutConsumerProperties properties;
    private final Map<DispatchOutcome, Counter> outcomeCounters = new EnumMap<>(DispatchOutcome.class);

    public CheckoutEventDispatcher(EventSerializer serializer,
                                   CheckoutEventMapper mapper,
                                   OrderCreationService orderCreationService,
                                   CheckoutConsumerProperties properties,
                                   MeterRegistry meterRegistry) {
        this.serializer = serializer;
        this.mapper = mapper;
        this.orderCreationService = orderCreationService;
        this.properties = properties;
        for (DispatchOutcome outcome : DispatchOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("checkout.events.dispatched")
                    .tag("outcome", outcome.name())
                    .description("Checkout messages handled by the ordering consumer")
                    .register(meterRegistry));
        }
    }

    public DispatchOutcome dispatch(String routingKey, String payload) {
        return count(doDispatch(routingKey, payload));
    }

    private DispatchOutcome doDispatch(String routingKey, String payload) {
        if (!properties.getTopic().equals(routingKey)) {
            log.warn("Ignoring message with unexpected routing key: routingKey={}, expected={}",
                    routingKey, properties.getTopic());
            return DispatchOutcome.IGNORED;
        }

        BasketCheckoutEvent event;
        try {
            event = serializer.deserialize(payload, BasketCheckoutEvent.class);
        } catch (EventDeserializationException e) {
            log.warn("Dropping malformed checkout message: routingKey={}, error={}", routingKey, e.getMessage());
            return DispatchOutcome.DROPPED_MALFORMED;
        }

        try {
            CreateOrderCommand command = mapper.toCommand(event);
            OrderCreationResult result = orderCreationService.createOrder(command, event.getId());

            if (!result.isCreated()) {
                log.info("Duplicate checkout event: eventId={}, orderId={}", event.getId(), result.getOrderId());
                return DispatchOutcome.DUPLICATE;
            }
            log.info("Checkout event processed: eventId={}, orderId={}, userName={}, correlationId={}",
                    event.getId(), result.getOrderId(), event.getUserName(), result.getCorrelationId());
            return DispatchOutcome.PROCESSED;

        } catch (OrderValidationException e) {
            log.warn("Checkout event rejected: eventId={}, userName={}, violations={}",
                    event.getId(), event.getUserName(), e.getViolations());
            return DispatchOutcome.REJECTED;
        } catch (OrderPersistenceException e) {
            log.warn("Order store unavailable, checkout event will be redelivered: eventId={}, error={}",
                    event.getId(), e.getMessage());
            return DispatchOutcome.RETRY;
        } catch (RuntimeException e) {
            log.error("Failed to process checkout event: eventId={}, userName={}, error={}",
                    event.getId(), event.getUserName(), e.getMessage(), e);
            return DispatchOutcome.FAILED;
        }
    }

    private DispatchOutcome count(DispatchOutcome outcome) {
        outcomeCounters.get(outcome).increment();
        return outcome;
    }
}
