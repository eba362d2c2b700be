package com.shopflow.order.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Payment details as captured at checkout. Not charged here.
 */
@Embeddable
@Getter
@Builder
@ToString(exclude = {"cardNumber", "cvv"})
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Column(name = "card_name", length = 100)
    private String cardName;

    @JsonIgnore
    @Column(name = "card_number", length = 30)
    private String cardNumber;

    @Column(name = "card_expiration", length = 10)
    private String expiration;

    @JsonIgnore
    @Column(name = "card_cvv", length = 3)
    private String cvv;

    @Column(name = "payment_method")
    private int paymentMethod;
}
