package com.shopflow.order.messaging;

import com.shopflow.order.domain.CreateOrderCommand;
import com.shopflow.order.domain.CreateOrderCommand.AddressInfo;
import com.shopflow.order.domain.CreateOrderCommand.OrderLine;
import com.shopflow.order.domain.CreateOrderCommand.PaymentInfo;
import com.shopflow.shared.events.Events.BasketCheckoutEvent;
import com.shopflow.shared.events.Events.CheckoutItem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * basket.checkout event → create-order command.
 *
 *  customerId       buyerId, or userName when the buyer id is absent
 *  orderName        userName
 *  shipping/billing the single checkout address
 *  items            productId, quantity, price (color is not kept on orders)
 */
@Component
public class CheckoutEventMapper {

    public CreateOrderCommand toCommand(BasketCheckoutEvent event) {
        String customerId = event.getBuyerId() != null && !event.getBuyerId().isBlank()
                ? event.getBuyerId() : event.getUserName();

        return CreateOrderCommand.builder()
                .customerId(customerId)
                .orderName(event.getUserName())
                .shippingAddress(toAddress(event))
                .billingAddress(toAddress(event))
                .payment(PaymentInfo.builder()
                        .cardName(event.getCardName())
                        .cardNumber(event.getCardNumber())
                        .expiration(event.getExpiration())
                        .cvv(event.getCvv())
                        .paymentMethod(event.getPaymentMethod())
                        .build())
                .items(toLines(event.getItems()))
                .correlationId(event.getCorrelationId())
                .build();
    }

    private static AddressInfo toAddress(BasketCheckoutEvent event) {
        return AddressInfo.builder()
                .firstName(event.getFirstName())
                .lastName(event.getLastName())
                .emailAddress(event.getEmailAddress())
                .addressLine(event.getAddressLine())
                .country(event.getCountry())
                .state(event.getState())
                .zipCode(event.getZipCode())
                .build();
    }

    private static List<OrderLine> toLines(List<CheckoutItem> items) {
        return items.stream()
                .map(item -> OrderLine.builder()
                        .productId(item.getProductId())
                        .quantity(item.getQuantity())
                        .price(item.getPrice())
                        .build())
                .toList();
    }
}
