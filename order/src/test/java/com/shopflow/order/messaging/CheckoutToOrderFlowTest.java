package com.shopflow.order.messaging;

import com.shopflow.basket.config.CheckoutProperties;
import com.shopflow.basket.domain.BasketNotFoundException;
import com.shopflow.basket.domain.CheckoutPublishException;
import com.shopflow.basket.domain.ShoppingCart;
import com.shopflow.basket.domain.ShoppingCartItem;
import com.shopflow.basket.repository.BasketStore;
import com.shopflow.basket.service.CheckoutDetails;
import com.shopflow.basket.service.CheckoutReceipt;
import com.shopflow.basket.service.CheckoutService;
import com.shopflow.order.OrderFixtures;
import com.shopflow.order.config.CheckoutConsumerProperties;
import com.shopflow.order.domain.Order;
import com.shopflow.order.domain.OrderItem;
import com.shopflow.order.repository.OrderRepository;
import com.shopflow.order.service.OrderCommandValidator;
import com.shopflow.order.service.OrderCreationService;
import com.shopflow.shared.events.EventSerializer;
import com.shopflow.shared.events.EventTypes;
import com.shopflow.shared.events.Events.BasketCheckoutEvent;
import com.shopflow.shared.kafka.BrokerConnectionManager;
import com.shopflow.shared.kafka.BrokerProperties;
import com.shopflow.shared.kafka.EventPublisher;
import com.shopflow.shared.outbox.OutboxRecord;
import com.shopflow.shared.outbox.OutboxRelayService;
import com.shopflow.shared.outbox.OutboxRepository;
import com.shopflow.shared.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.SendResult;
import org.springframework.transaction.CannotCreateTransactionException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Checkout to order, end to end without a broker.
 *
 * A basket is checked out through the basket service, the publisher's record is
 * handed to the consumer side as a delivered record, then runs through the real
 * listener, dispatcher, mapper and creation pipeline against a map-backed order
 * repository. In OUTBOX mode the staged row goes through the relay first.
 */
@ExtendWith(MockitoExtension.class)
class CheckoutToOrderFlowTest {

    @Mock BrokerConnectionManager connectionManager;
    @Mock KafkaTemplate<String, String> kafkaTemplate;
    @Mock BasketStore basketStore;
    @Mock OutboxRepository outboxRepository;
    @Mock OrderRepository orderRepository;
    @Mock Acknowledgment acknowledgment;

    @Captor ArgumentCaptor<ProducerRecord<String, String>> producerRecordCaptor;

    ValidatorFactory validatorFactory;
    Map<String, Order> store;
    List<OutboxRecord> staged;
    EventPublisher publisher;
    CheckoutProperties checkoutProperties;
    CheckoutService checkoutService;
    OutboxRelayService relayService;
    CheckoutEventListener listener;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        EventSerializer serializer = new EventSerializer(EventSerializer.createObjectMapper());
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

        // Lenient: the staging-failure case never reaches the broker
        lenient().when(connectionManager.producerChannel()).thenReturn(kafkaTemplate);
        lenient().doAnswer(invocation -> {
            ProducerRecord<String, String> record = invocation.getArgument(0);
            RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 0L, 0, 0L, 0, 0);
            return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
        }).when(kafkaTemplate).send(producerRecordCaptor.capture());
        BrokerProperties brokerProperties = new BrokerProperties();
        publisher = new EventPublisher(connectionManager, serializer, brokerProperties, meterRegistry);

        staged = new ArrayList<>();
        checkoutProperties = new CheckoutProperties();
        checkoutService = new CheckoutService(basketStore, publisher,
                new OutboxService(outboxRepository, serializer), checkoutProperties);
        relayService = new OutboxRelayService(outboxRepository, publisher, brokerProperties, meterRegistry);

        store = OrderFixtures.inMemory(orderRepository);
        CheckoutConsumerProperties properties = new CheckoutConsumerProperties();
        OrderCreationService creationService = new OrderCreationService(orderRepository,
                new OrderCommandValidator(validatorFactory.getValidator()), properties);
        CheckoutEventDispatcher dispatcher = new CheckoutEventDispatcher(serializer, new CheckoutEventMapper(),
                creationService, properties, meterRegistry);
        listener = new CheckoutEventListener(dispatcher);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static ShoppingCart swnBasket() {
        return new ShoppingCart("swn", List.of(new ShoppingCartItem("X", 2, new BigDecimal("25.00"), "Black")));
    }

    private static CheckoutDetails swnDetails() {
        return CheckoutDetails.builder()
                .firstName("Mehmet")
                .lastName("Ozkaya")
                .emailAddress("swn@example.com")
                .addressLine("Bahcelievler")
                .country("Turkey")
                .state("Istanbul")
                .zipCode("34000")
                .cardName("Mehmet Ozkaya")
                .cardNumber("5555555555554444")
                .expiration("12/28")
                .cvv("123")
                .paymentMethod(1)
                .build();
    }

    private void stageOutboxRowsInMemory() {
        checkoutProperties.setPublishMode(CheckoutProperties.PublishMode.OUTBOX);
        when(outboxRepository.save(any(OutboxRecord.class))).thenAnswer(invocation -> {
            OutboxRecord record = invocation.getArgument(0);
            staged.add(record);
            return record;
        });
        when(outboxRepository.findDueForRelay(any(), anyInt())).thenAnswer(invocation ->
                staged.stream().filter(record -> !record.isPublished()).toList());
    }

    private List<ProducerRecord<String, String>> sent() {
        return producerRecordCaptor.getAllValues();
    }

    private static ConsumerRecord<String, String> delivered(ProducerRecord<String, String> record, long offset) {
        ConsumerRecord<String, String> consumed =
                new ConsumerRecord<>(record.topic(), 0, offset, record.key(), record.value());
        for (Header header : record.headers()) {
            consumed.headers().add(header);
        }
        return consumed;
    }

    private static void assertSwnOrder(Order order) {
        assertThat(order.getCustomerId()).isEqualTo("swn");
        assertThat(order.getTotalPrice()).isEqualByComparingTo(new BigDecimal("50.00"));
        assertThat(order.getItems()).hasSize(1);
        OrderItem item = order.getItems().get(0);
        assertThat(item.getProductId()).isEqualTo("X");
        assertThat(item.getQuantity()).isEqualTo(2);
        assertThat(item.getPrice()).isEqualByComparingTo(new BigDecimal("25.00"));
    }

    // ─── From a published event ───────────────────────────────────────────────

    @Test
    @DisplayName("checkout event for swn — exactly one order with the basket's line and total")
    void checkout_createsOneOrder() {
        BasketCheckoutEvent event = OrderFixtures.swnCheckoutEvent();

        publisher.publishAndWait(EventTypes.TOPIC_BASKET_CHECKOUT, event);
        assertThat(sent()).hasSize(1);

        listener.onMessage(delivered(sent().get(0), 0L), acknowledgment);

        verify(acknowledgment).acknowledge();
        assertThat(store).hasSize(1);
        Order order = store.values().iterator().next();
        assertSwnOrder(order);
        assertThat(order.getSourceEventId()).isEqualTo(event.getId());
        assertThat(order.getCorrelationId()).isEqualTo(event.getCorrelationId());
    }

    @Test
    @DisplayName("redelivery of the same message — acknowledged again, still one order")
    void redelivery_doesNotDuplicate() {
        publisher.publishAndWait(EventTypes.TOPIC_BASKET_CHECKOUT, OrderFixtures.swnCheckoutEvent());
        ConsumerRecord<String, String> record = delivered(sent().get(0), 0L);

        listener.onMessage(record, acknowledgment);
        listener.onMessage(record, acknowledgment);

        verify(acknowledgment, times(2)).acknowledge();
        assertThat(store).hasSize(1);
    }

    // ─── From the basket, DIRECT mode ─────────────────────────────────────────

    @Test
    @DisplayName("swn's basket of two X at 25.00 — checkout totals 50.00 and yields one order")
    void basketCheckout_direct_createsOneOrder() {
        when(basketStore.getBasket("swn")).thenReturn(Optional.of(swnBasket()));
        when(basketStore.deleteBasket("swn")).thenReturn(true);

        CheckoutReceipt receipt = checkoutService.checkout("swn", swnDetails());

        assertThat(receipt.getTotalPrice()).isEqualByComparingTo("50.00");
        verify(basketStore).deleteBasket("swn");
        assertThat(sent()).hasSize(1);
        assertThat(sent().get(0).topic()).isEqualTo(EventTypes.TOPIC_BASKET_CHECKOUT);

        listener.onMessage(delivered(sent().get(0), 0L), acknowledgment);

        verify(acknowledgment).acknowledge();
        assertThat(store).hasSize(1);
        Order order = store.values().iterator().next();
        assertSwnOrder(order);
        assertThat(order.getSourceEventId()).isEqualTo(receipt.getEventId());
        assertThat(order.getCorrelationId()).isEqualTo(receipt.getCorrelationId());
        verifyNoInteractions(outboxRepository);
    }

    // ─── From the basket, OUTBOX mode ─────────────────────────────────────────

    @Test
    @DisplayName("outbox checkout — staged row is relayed under its event id and yields one order")
    void basketCheckout_outbox_relayedToOneOrder() {
        stageOutboxRowsInMemory();
        when(basketStore.getBasket("swn")).thenReturn(Optional.of(swnBasket()));
        when(basketStore.deleteBasket("swn")).thenReturn(true);

        CheckoutReceipt receipt = checkoutService.checkout("swn", swnDetails());
        assertThat(sent()).isEmpty();
        assertThat(staged).hasSize(1);

        assertThat(relayService.relay()).isEqualTo(1);
        assertThat(sent()).hasSize(1);

        listener.onMessage(delivered(sent().get(0), 0L), acknowledgment);

        assertThat(store).hasSize(1);
        Order order = store.values().iterator().next();
        assertSwnOrder(order);
        assertThat(order.getSourceEventId()).isEqualTo(receipt.getEventId());
        assertThat(relayService.relay()).isZero();
    }

    @Test
    @DisplayName("outbox double submit — second checkout is BasketNotFound, one row, one order")
    void basketCheckout_outbox_doubleSubmit() {
        stageOutboxRowsInMemory();
        when(basketStore.getBasket("swn")).thenReturn(Optional.of(swnBasket()));
        when(basketStore.deleteBasket("swn")).thenReturn(true, false);

        CheckoutReceipt first = checkoutService.checkout("swn", swnDetails());
        assertThatThrownBy(() -> checkoutService.checkout("swn", swnDetails()))
                .isInstanceOf(BasketNotFoundException.class);

        assertThat(staged).hasSize(1);
        relayService.relay();
        assertThat(sent()).hasSize(1);
        listener.onMessage(delivered(sent().get(0), 0L), acknowledgment);

        assertThat(store).hasSize(1);
        assertThat(store.values().iterator().next().getSourceEventId()).isEqualTo(first.getEventId());
        verify(basketStore, never()).storeBasket(any());
    }

    @Test
    @DisplayName("outbox transaction cannot start — PublishFailed, basket put back, nothing relayed")
    void basketCheckout_outbox_transactionStartFailure() {
        checkoutProperties.setPublishMode(CheckoutProperties.PublishMode.OUTBOX);
        ShoppingCart basket = swnBasket();
        when(basketStore.getBasket("swn")).thenReturn(Optional.of(basket));
        when(basketStore.deleteBasket("swn")).thenReturn(true);
        when(outboxRepository.save(any(OutboxRecord.class)))
                .thenThrow(new CannotCreateTransactionException("connection refused"));

        assertThatThrownBy(() -> checkoutService.checkout("swn", swnDetails()))
                .isInstanceOf(CheckoutPublishException.class);

        verify(basketStore).storeBasket(basket);
        assertThat(sent()).isEmpty();
        assertThat(store).isEmpty();
    }
}
