package com.shopflow.basket.api;

import com.shopflow.basket.domain.BasketNotFoundException;
import com.shopflow.basket.domain.ShoppingCart;
import com.shopflow.basket.repository.BasketStore;
import com.shopflow.basket.service.CheckoutDetails;
import com.shopflow.basket.service.CheckoutReceipt;
import com.shopflow.basket.service.CheckoutService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Basket REST Controller
 *
 * GET    /api/v1/basket/{userName}           → current basket
 * POST   /api/v1/basket                      → store (replace) a basket
 * DELETE /api/v1/basket/{userName}           → drop a basket
 * POST   /api/v1/basket/{userName}/checkout  → 202, event id for tracing
 */
@RestController
@RequestMapping("/api/v1/basket")
@RequiredArgsConstructor
public class BasketController {

    private final BasketStore basketStore;
    private final CheckoutService checkoutService;

    @GetMapping("/{userName}")
    public ResponseEntity<ShoppingCart> getBasket(@PathVariable String userName) {
        return basketStore.getBasket(userName)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new BasketNotFoundException(userName));
    }

    @PostMapping
    public ResponseEntity<ShoppingCart> storeBasket(@Valid @RequestBody ShoppingCart cart) {
        return ResponseEntity.ok(basketStore.storeBasket(cart));
    }

    @DeleteMapping("/{userName}")
    public ResponseEntity<Void> deleteBasket(@PathVariable String userName) {
        if (!basketStore.deleteBasket(userName)) {
            throw new BasketNotFoundException(userName);
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{userName}/checkout")
    public ResponseEntity<CheckoutReceipt> checkout(@PathVariable String userName,
                                                    @RequestBody CheckoutDetails details) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(checkoutService.checkout(userName, details));
    }
}
