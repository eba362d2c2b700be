package com.shopflow.basket.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * A user's basket, keyed by user name.
 *
 * The total is never stored; it is always the sum of item subtotals.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ShoppingCart {

    @NotBlank
    private String userName;

    @Valid
    private List<ShoppingCartItem> items = new ArrayList<>();

    public ShoppingCart(String userName) {
        this.userName = userName;
    }

    public ShoppingCart(String userName, List<ShoppingCartItem> items) {
        this.userName = userName;
        setItems(items);
    }

    public void setItems(List<ShoppingCartItem> items) {
        this.items = items != null ? items : new ArrayList<>();
    }

    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public BigDecimal getTotalPrice() {
        return items.stream()
                .map(ShoppingCartItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
