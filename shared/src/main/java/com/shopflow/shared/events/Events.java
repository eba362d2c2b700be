package com.shopflow.shared.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * All integration event payload classes.
 * Each event extends DomainEvent and adds its specific payload.
 *
 * Naming: {Noun}{Verb}Event — e.g. BasketCheckoutEvent
 */
public final class Events {

    private Events() {}

    /**
     * Amounts travel in plain notation, so a negative scale (1E+1) would not survive the
     * wire. Normalized to scale 0 at construction; equality then holds across a round trip.
     */
    static BigDecimal plain(BigDecimal amount) {
        return amount != null && amount.scale() < 0 ? amount.setScale(0) : amount;
    }

    // ─── Basket Events ─────────────────────────────────────────────────────────

    /**
     * Raised once per checkout, after the basket has been removed from the store.
     * Flat by contract: shipping and payment fields sit next to the totals so the
     * wire schema can evolve independently of the ordering command it maps into.
     * Card fields are placeholders carried for the order record, not a payment instruction.
     */
    @Getter
    @ToString(callSuper = true, exclude = {"cardNumber", "cvv"})
    @EqualsAndHashCode(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BasketCheckoutEvent extends DomainEvent {
        private final String userName;
        private final String buyerId;
        private final BigDecimal totalPrice;

        private final String firstName;
        private final String lastName;
        private final String emailAddress;
        private final String addressLine;
        private final String country;
        private final String state;
        private final String zipCode;

        private final String cardName;
        private final String cardNumber;
        private final String expiration;
        private final String cvv;
        private final int paymentMethod;

        private final List<CheckoutItem> items;

        @Builder
        private BasketCheckoutEvent(String userName, String buyerId, BigDecimal totalPrice,
                                    String firstName, String lastName, String emailAddress,
                                    String addressLine, String country, String state, String zipCode,
                                    String cardName, String cardNumber, String expiration, String cvv,
                                    int paymentMethod, List<CheckoutItem> items, String correlationId) {
            super(EventTypes.BASKET_CHECKOUT, EventTypes.SOURCE_BASKET_SERVICE, correlationId);
            this.userName = userName;
            this.buyerId = buyerId;
            this.totalPrice = plain(totalPrice);
            this.firstName = firstName;
            this.lastName = lastName;
            this.emailAddress = emailAddress;
            this.addressLine = addressLine;
            this.country = country;
            this.state = state;
            this.zipCode = zipCode;
            this.cardName = cardName;
            this.cardNumber = cardNumber;
            this.expiration = expiration;
            this.cvv = cvv;
            this.paymentMethod = paymentMethod;
            this.items = items != null ? List.copyOf(items) : List.of();
        }

        @JsonCreator
        public BasketCheckoutEvent(@JsonProperty("id") String id,
                                   @JsonProperty("type") String type,
                                   @JsonProperty("source") String source,
                                   @JsonProperty("time") Instant time,
                                   @JsonProperty("correlationId") String correlationId,
                                   @JsonProperty("causationId") String causationId,
                                   @JsonProperty("version") int version,
                                   @JsonProperty("userName") String userName,
                                   @JsonProperty("buyerId") String buyerId,
                                   @JsonProperty("totalPrice") BigDecimal totalPrice,
                                   @JsonProperty("firstName") String firstName,
                                   @JsonProperty("lastName") String lastName,
                                   @JsonProperty("emailAddress") String emailAddress,
                                   @JsonProperty("addressLine") String addressLine,
                                   @JsonProperty("country") String country,
                                   @JsonProperty("state") String state,
                                   @JsonProperty("zipCode") String zipCode,
                                   @JsonProperty("cardName") String cardName,
                                   @JsonProperty("cardNumber") String cardNumber,
                                   @JsonProperty("expiration") String expiration,
                                   @JsonProperty("cvv") String cvv,
                                   @JsonProperty("paymentMethod") int paymentMethod,
                                   @JsonProperty("items") List<CheckoutItem> items) {
            super(id, type, source, time, correlationId, causationId, version);
            this.userName = userName;
            this.buyerId = buyerId;
            this.totalPrice = plain(totalPrice);
            this.firstName = firstName;
            this.lastName = lastName;
            this.emailAddress = emailAddress;
            this.addressLine = addressLine;
            this.country = country;
            this.state = state;
            this.zipCode = zipCode;
            this.cardName = cardName;
            this.cardNumber = cardNumber;
            this.expiration = expiration;
            this.cvv = cvv;
            this.paymentMethod = paymentMethod;
            this.items = items != null ? List.copyOf(items) : List.of();
        }
    }

    // ─── Value Objects ─────────────────────────────────────────────────────────

    @Getter
    @ToString
    @EqualsAndHashCode
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CheckoutItem {
        private final String productId;
        private final int quantity;
        private final BigDecimal price;
        private final String color;

        @JsonCreator
        public CheckoutItem(@JsonProperty("productId") String productId,
                            @JsonProperty("quantity") int quantity,
                            @JsonProperty("price") BigDecimal price,
                            @JsonProperty("color") String color) {
            this.productId = productId;
            this.quantity = quantity;
            this.price = plain(price);
            this.color = color;
        }
    }
}
