package com.shopflow.order.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Create Order Command: the single input shape of order creation.
 * The REST endpoint binds it from JSON; the checkout consumer maps events into it.
 *
 * Size and digit limits mirror the orders and order_items columns, so a command that
 * validates can be stored exactly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {

    @NotBlank @Size(max = 100)
    private String customerId;

    @NotBlank @Size(max = 100)
    private String orderName;

    @NotNull @Valid
    private AddressInfo shippingAddress;

    @NotNull @Valid
    private AddressInfo billingAddress;

    @NotNull @Valid
    private PaymentInfo payment;

    @NotEmpty @Valid
    private List<OrderLine> items;

    /** Optional; generated when absent */
    @Size(max = 36)
    private String correlationId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AddressInfo {
        @NotBlank @Size(max = 100) private String firstName;
        @NotBlank @Size(max = 100) private String lastName;
        @NotBlank @Email @Size(max = 200) private String emailAddress;
        @NotBlank @Size(max = 300) private String addressLine;
        @NotBlank @Size(max = 100) private String country;
        @Size(max = 100) private String state;
        @NotBlank @Size(max = 20) private String zipCode;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @ToString(exclude = {"cardNumber", "cvv"})
    public static class PaymentInfo {
        @NotBlank @Size(max = 100) private String cardName;
        @NotBlank @Size(max = 30) private String cardNumber;
        @Size(max = 10) private String expiration;
        @Size(max = 3) private String cvv;
        private int paymentMethod;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderLine {
        @NotBlank @Size(max = 100) private String productId;
        @Min(1) private int quantity;
        @NotNull @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) private BigDecimal price;
    }
}
